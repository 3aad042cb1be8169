package com.example.callaudit_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({BatchEngineProperties.class, BatchSizerProperties.class, QuotaProperties.class, DetectorProperties.class})
public class AppPropertiesConfig {
}
