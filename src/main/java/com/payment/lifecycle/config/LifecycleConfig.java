package com.payment.lifecycle.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Wires the typed configuration and the shared clock.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties({GatewayProperties.class, ReconciliationProperties.class})
public class LifecycleConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
