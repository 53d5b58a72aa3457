package ru.tigran.quotaadmission.counter;

import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RMap;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import ru.tigran.quotaadmission.exception.StoreUnavailableException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Redis-backed quota counters. Each research study owns three hashes keyed by cellKey:
 * counts, caps and last update time (epoch millis). Every admission attempt additionally gets a
 * short-lived operation hash (cellKey to the count it produced, or R once rolled back) that makes
 * replayed increments and decrements no-ops. The hash tag {researchId} keeps all of these keys in
 * the same cluster slot so a single Lua script can touch them atomically.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.quota.counter-store", havingValue = "redis", matchIfMissing = true)
public class RedissonQuotaCounterStore implements QuotaCounterStore {

    // KEYS: counts, caps, updated, operation; ARGV: cellKey, cap, now, operation ttl
    static final String INCREMENT_IF_BELOW_CAP_SCRIPT = """
            local recorded = redis.call('HGET', KEYS[4], ARGV[1])
            if recorded then
                if recorded == 'R' then
                    return {0, tonumber(redis.call('HGET', KEYS[1], ARGV[1]) or '0')}
                end
                return {1, tonumber(recorded)}
            end
            local count = tonumber(redis.call('HGET', KEYS[1], ARGV[1]) or '0')
            local cap = tonumber(ARGV[2])
            if count < cap then
                count = redis.call('HINCRBY', KEYS[1], ARGV[1], 1)
                redis.call('HSET', KEYS[2], ARGV[1], ARGV[2])
                redis.call('HSET', KEYS[3], ARGV[1], ARGV[3])
                redis.call('HSET', KEYS[4], ARGV[1], count)
                redis.call('PEXPIRE', KEYS[4], ARGV[4])
                return {1, count}
            end
            redis.call('HSETNX', KEYS[2], ARGV[1], ARGV[2])
            return {0, count}
            """;

    // KEYS: counts, updated, operation; ARGV: cellKey, now
    static final String DECREMENT_SCRIPT = """
            local count = tonumber(redis.call('HGET', KEYS[1], ARGV[1]) or '0')
            local recorded = redis.call('HGET', KEYS[3], ARGV[1])
            if not recorded or recorded == 'R' then
                return count
            end
            redis.call('HSET', KEYS[3], ARGV[1], 'R')
            if count > 0 then
                count = redis.call('HINCRBY', KEYS[1], ARGV[1], -1)
                redis.call('HSET', KEYS[2], ARGV[1], ARGV[2])
            end
            return count
            """;

    static final String RESET_SCRIPT = """
            local fields = redis.call('HKEYS', KEYS[1])
            for _, field in ipairs(fields) do
                redis.call('HSET', KEYS[1], field, 0)
                redis.call('HSET', KEYS[2], field, ARGV[1])
            end
            return #fields
            """;

    private static final String KEY_PREFIX = "quota:";
    private static final String HEALTH_KEY = KEY_PREFIX + "health";

    private final RedissonClient redissonClient;
    private final Clock clock;
    private final long operationTtlMs;

    public RedissonQuotaCounterStore(
            RedissonClient redissonClient,
            Clock clock,
            @Value("${app.quota.operation-ttl-ms:600000}") long operationTtlMs
    ) {
        this.redissonClient = redissonClient;
        this.clock = clock;
        this.operationTtlMs = operationTtlMs;
    }

    @Override
    public IncrementResult incrementIfBelowCap(String researchId, String cellKey, int cap, String operationId) {
        List<Object> reply = execute(researchId, cellKey, () -> script().eval(
                RScript.Mode.READ_WRITE,
                INCREMENT_IF_BELOW_CAP_SCRIPT,
                RScript.ReturnType.MULTI,
                List.of(countsKey(researchId), capsKey(researchId), updatedKey(researchId),
                        operationKey(researchId, operationId)),
                cellKey, String.valueOf(cap), String.valueOf(clock.millis()), String.valueOf(operationTtlMs)
        ));

        if (reply == null || reply.size() != 2) {
            throw new StoreUnavailableException("Unexpected reply from counter store for cell " + cellKey);
        }
        boolean success = toLong(reply.get(0)) == 1L;
        long count = toLong(reply.get(1));
        log.debug("incrementIfBelowCap research={} cell={} cap={} operation={} -> success={}, count={}",
                researchId, cellKey, cap, operationId, success, count);
        return new IncrementResult(success, count);
    }

    @Override
    public long decrement(String researchId, String cellKey, String operationId) {
        Object reply = execute(researchId, cellKey, () -> script().eval(
                RScript.Mode.READ_WRITE,
                DECREMENT_SCRIPT,
                RScript.ReturnType.INTEGER,
                List.of(countsKey(researchId), updatedKey(researchId), operationKey(researchId, operationId)),
                cellKey, String.valueOf(clock.millis())
        ));
        return toLong(reply);
    }

    @Override
    public List<QuotaCounter> findAll(String researchId) {
        return execute(researchId, "*", () -> {
            Map<String, String> counts = hash(countsKey(researchId)).readAllMap();
            Map<String, String> caps = hash(capsKey(researchId)).readAllMap();
            Map<String, String> updated = hash(updatedKey(researchId)).readAllMap();

            List<QuotaCounter> counters = new ArrayList<>(counts.size());
            counts.forEach((cellKey, count) -> counters.add(new QuotaCounter(
                    researchId,
                    cellKey,
                    Long.parseLong(count),
                    caps.containsKey(cellKey) ? Integer.parseInt(caps.get(cellKey)) : 0,
                    updated.containsKey(cellKey) ? Instant.ofEpochMilli(Long.parseLong(updated.get(cellKey))) : null
            )));
            counters.sort(Comparator.comparing(QuotaCounter::cellKey));
            return counters;
        });
    }

    @Override
    public int resetAll(String researchId) {
        Object reply = execute(researchId, "*", () -> script().eval(
                RScript.Mode.READ_WRITE,
                RESET_SCRIPT,
                RScript.ReturnType.INTEGER,
                List.of(countsKey(researchId), updatedKey(researchId)),
                String.valueOf(clock.millis())
        ));
        return (int) toLong(reply);
    }

    @Override
    public boolean isAvailable() {
        try {
            redissonClient.getBucket(HEALTH_KEY, StringCodec.INSTANCE).isExists();
            return true;
        } catch (RedisException e) {
            log.warn("Counter store health check failed: {}", e.getMessage());
            return false;
        }
    }

    static String countsKey(String researchId) {
        return KEY_PREFIX + "{" + researchId + "}:counts";
    }

    static String capsKey(String researchId) {
        return KEY_PREFIX + "{" + researchId + "}:caps";
    }

    static String updatedKey(String researchId) {
        return KEY_PREFIX + "{" + researchId + "}:updated";
    }

    static String operationKey(String researchId, String operationId) {
        return KEY_PREFIX + "{" + researchId + "}:op:" + operationId;
    }

    private RScript script() {
        return redissonClient.getScript(StringCodec.INSTANCE);
    }

    private RMap<String, String> hash(String key) {
        return redissonClient.getMap(key, StringCodec.INSTANCE);
    }

    private <T> T execute(String researchId, String cellKey, StoreCall<T> call) {
        try {
            return call.run();
        } catch (RedisException e) {
            log.warn("Counter store call failed for research {} cell {}: {}", researchId, cellKey, e.getMessage());
            throw new StoreUnavailableException("Quota counter store unavailable: " + e.getMessage(), e);
        }
    }

    private static long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            return Long.parseLong(text);
        }
        throw new StoreUnavailableException("Unexpected numeric reply from counter store: " + value);
    }

    @FunctionalInterface
    private interface StoreCall<T> {
        T run();
    }
}
