package com.purchasingpower.micros.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Registers the pipeline configuration classes and the shared clock.
 *
 * <p>The clock decides what "today" means for date resolution, meal timestamps and
 * tool-loop deadlines; tests replace it with a fixed clock.
 */
@Configuration
@EnableConfigurationProperties({
    AssistantConfig.class
})
public class ConfigurationPropertiesEnablerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
