package ru.tigran.quotaadmission.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import ru.tigran.quotaadmission.dto.QuotaConfig;

import java.time.Duration;

@Configuration
@EnableCaching
@Profile("!test")
public class CacheConfig {

    public static final String QUOTA_CONFIG_CACHE = "quotaConfigCache";

    /**
     * Redis cache manager для конфигураций квот.
     * - TTL: app.quota.config-cache-ttl-minutes (5 минут по умолчанию)
     * - Null values: не кешируются (исследование без квот перечитывается из БД)
     * - Serialization: JSON, типизированный QuotaConfig (без @class в значениях)
     * - Transaction aware: put/evict внутри транзакции выполняются только после commit,
     *   иначе параллельное чтение может закешировать старую конфигурацию на весь TTL
     */
    @Bean
    public CacheManager cacheManager(
            RedisConnectionFactory connectionFactory,
            @Value("${app.quota.config-cache-ttl-minutes:5}") long ttlMinutes
    ) {
        RedisCacheConfiguration config = RedisCacheConfiguration.defaultCacheConfig()
                .entryTtl(Duration.ofMinutes(ttlMinutes))
                .disableCachingNullValues()
                .serializeKeysWith(
                    RedisSerializationContext.SerializationPair.fromSerializer(
                        new StringRedisSerializer()
                    )
                )
                .serializeValuesWith(
                    RedisSerializationContext.SerializationPair.fromSerializer(
                        new Jackson2JsonRedisSerializer<>(QuotaConfig.class)
                    )
                );

        return RedisCacheManager.builder(connectionFactory)
                .cacheDefaults(config)
                .withCacheConfiguration(QUOTA_CONFIG_CACHE, config)
                .transactionAware()
                .build();
    }
}
