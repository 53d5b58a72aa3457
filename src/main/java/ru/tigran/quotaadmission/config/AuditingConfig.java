package ru.tigran.quotaadmission.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.domain.AuditorAware;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

import java.util.Optional;

/**
 * Конфигурация для поддержки аудита конфигураций квот
 * Автоматически заполняет createdBy, updatedBy, createdAt, updatedAt
 */
@Configuration
@EnableJpaAuditing
public class AuditingConfig {

    /**
     * Аутентификация в этом сервисе не выполняется, все изменения записываются от 'system'
     */
    @Bean
    public AuditorAware<String> auditorAware() {
        return () -> Optional.of("system");
    }
}
