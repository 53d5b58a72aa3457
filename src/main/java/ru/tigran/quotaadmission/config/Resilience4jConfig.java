package ru.tigran.quotaadmission.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.tigran.quotaadmission.exception.StoreUnavailableException;

import java.time.Duration;

/**
 * Конфигурация Resilience4j для ограниченных повторов операций со счётчиками квот.
 * Повторяется только StoreUnavailableException; решения "квота исчерпана" не повторяются.
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    public static final String COUNTER_STORE_RETRY = "quotaCounterStore";
    public static final String ROLLBACK_RETRY = "quotaRollback";

    /**
     * Экспоненциальный backoff: 50ms, 100ms, ... не более max-attempts попыток
     */
    @Bean
    public RetryRegistry retryRegistry(
            @Value("${app.quota.store-retry.max-attempts:3}") int maxAttempts,
            @Value("${app.quota.store-retry.initial-backoff-ms:50}") long initialBackoffMs,
            @Value("${app.quota.store-retry.multiplier:2.0}") double multiplier
    ) {
        RetryRegistry registry = RetryRegistry.of(
            RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(initialBackoffMs), multiplier))
                .retryExceptions(StoreUnavailableException.class)
                .build()
        );

        registry.getEventPublisher()
                .onEntryAdded(event -> log.info("Retry created: {}", event.getAddedEntry().getName()))
                .onEntryRemoved(event -> log.info("Retry removed: {}", event.getRemovedEntry().getName()))
                .onEntryReplaced(event -> log.info("Retry replaced: {}", event.getNewEntry().getName()));

        return registry;
    }

    /**
     * Retry для инкрементов и сброса счётчиков
     */
    @Bean
    public Retry quotaCounterStoreRetry(RetryRegistry registry) {
        return withLogging(registry.retry(COUNTER_STORE_RETRY));
    }

    /**
     * Retry для откатов уже выполненных инкрементов
     */
    @Bean
    public Retry quotaRollbackRetry(RetryRegistry registry) {
        return withLogging(registry.retry(ROLLBACK_RETRY));
    }

    private Retry withLogging(Retry retry) {
        retry.getEventPublisher()
                .onRetry(event -> log.warn("Retry {} attempt {} after: {}",
                    event.getName(),
                    event.getNumberOfRetryAttempts(),
                    event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"))
                .onError(event -> log.error("Retry {} exhausted after {} attempts",
                    event.getName(), event.getNumberOfRetryAttempts()));
        return retry;
    }
}
