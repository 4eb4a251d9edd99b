package com.example.modelvault_backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
class TimeConfig {

    /** Upload timestamps and render session deadlines both read this clock. */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
