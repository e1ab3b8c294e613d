package com.dcarunner.failure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FailureProperties.class)
public class FailureConfig {
}
