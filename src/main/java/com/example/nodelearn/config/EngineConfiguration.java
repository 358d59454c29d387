package com.example.nodelearn.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.time.ZoneOffset;

@Configuration
@EnableScheduling
public class EngineConfiguration {

    @Bean
    public Clock clock() {
        // archived timestamps and dwell totals are kept in milliseconds
        return Clock.tickMillis(ZoneOffset.UTC);
    }
}
