package ru.tigran.quotaadmission.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.tigran.quotaadmission.counter.QuotaCounterStore;

/**
 * Конфигурация health checks для хранилища счётчиков
 */
@Slf4j
@Configuration
public class HealthCheckConfig {

    /**
     * Без хранилища счётчиков ни один участник не может быть допущен, поэтому его
     * недоступность переводит сервис в DOWN.
     */
    @Bean
    public HealthIndicator quotaCounterStoreHealthIndicator(QuotaCounterStore counterStore) {
        return () -> {
            String storeType = counterStore.getClass().getSimpleName();
            if (counterStore.isAvailable()) {
                log.debug("Quota counter store health check: OK");
                return Health.up()
                        .withDetail("store", storeType)
                        .build();
            }
            log.warn("Quota counter store health check failed");
            return Health.down()
                    .withDetail("store", storeType)
                    .withDetail("error", "Counter store is unreachable")
                    .build();
        };
    }
}
