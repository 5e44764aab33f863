package com.phishguard.history.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class HistoryConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
