package com.newsvault.backend.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    /**
     * Single source of "now"; callers apply the canonical zone themselves
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
