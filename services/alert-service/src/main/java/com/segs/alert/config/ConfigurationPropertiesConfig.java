package com.segs.alert.config;

import com.segs.alert.config.properties.AlertProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Enables {@link AlertProperties} and provides the clock every component
 * reads "now" from.
 */
@Configuration
@EnableConfigurationProperties(AlertProperties.class)
public class ConfigurationPropertiesConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
