package ru.tigran.quotaadmission.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class QuotaEngineConfig {

    /**
     * Часы для timestamp'ов решений, deadline'ов и updatedAt счётчиков
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
