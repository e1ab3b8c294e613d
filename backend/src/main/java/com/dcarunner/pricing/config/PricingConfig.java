package com.dcarunner.pricing.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Pricing module configuration.
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfig {
}
