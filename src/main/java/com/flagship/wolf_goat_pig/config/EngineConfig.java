package com.flagship.wolf_goat_pig.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the rule configuration.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {
}
