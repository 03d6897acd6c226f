package io.github.jakubt4.celestial.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Supplies the wall clock used whenever a request or tracker tick does not name an instant.
 * Tests replace it with a fixed clock.
 */
@Configuration
public class ClockConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
