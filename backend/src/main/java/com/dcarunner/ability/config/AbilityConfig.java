package com.dcarunner.ability.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AbilityProperties.class)
public class AbilityConfig {
}
