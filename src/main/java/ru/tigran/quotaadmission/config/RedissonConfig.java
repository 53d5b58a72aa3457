package ru.tigran.quotaadmission.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурация Redisson для хранилища счётчиков квот.
 * Таймауты короче, чем deadline одной проверки участника, чтобы успеть откатить инкременты.
 */
@Configuration
@ConditionalOnProperty(name = "app.quota.counter-store", havingValue = "redis", matchIfMissing = true)
public class RedissonConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    @Value("${spring.data.redis.password:}")
    private String redisPassword;

    @Value("${app.quota.redis.timeout-ms:1000}")
    private int timeoutMs;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        Config config = new Config();

        String redisUrl = String.format("redis://%s:%d", redisHost, redisPort);

        SingleServerConfig server = config.useSingleServer()
                .setAddress(redisUrl)
                .setTimeout(timeoutMs)
                .setConnectTimeout(timeoutMs)
                // повторы выполняет Resilience4j, у Redisson их отключаем
                .setRetryAttempts(0)
                .setRetryInterval(100);

        if (redisPassword != null && !redisPassword.isEmpty()) {
            server.setPassword(redisPassword);
        }

        return Redisson.create(config);
    }
}
