package ru.tigran.quotaadmission.counter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-process counter store for local development and tests (app.quota.counter-store=memory).
 * Atomicity comes from {@link ConcurrentHashMap#compute}, which runs the check and the update for
 * one cell under that entry's lock. Counters are not shared between application instances.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.quota.counter-store", havingValue = "memory")
public class InMemoryQuotaCounterStore implements QuotaCounterStore {

    private static final long DEFAULT_OPERATION_TTL_MS = 600_000;

    private final Map<String, Map<String, QuotaCounter>> countersByResearch = new ConcurrentHashMap<>();
    // operationId:cellKey -> applied increment, per research
    private final Map<String, Map<String, Acquisition>> acquisitionsByResearch = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration operationTtl;

    public InMemoryQuotaCounterStore(Clock clock) {
        this(clock, DEFAULT_OPERATION_TTL_MS);
    }

    @Autowired
    public InMemoryQuotaCounterStore(Clock clock, @Value("${app.quota.operation-ttl-ms:600000}") long operationTtlMs) {
        this.clock = clock;
        this.operationTtl = Duration.ofMillis(operationTtlMs);
    }

    @Override
    public IncrementResult incrementIfBelowCap(String researchId, String cellKey, int cap, String operationId) {
        Map<String, Acquisition> acquisitions =
                acquisitionsByResearch.computeIfAbsent(researchId, id -> new ConcurrentHashMap<>());
        String acquisitionKey = acquisitionKey(operationId, cellKey);
        AtomicReference<IncrementResult> result = new AtomicReference<>();

        countersByResearch.computeIfAbsent(researchId, id -> new ConcurrentHashMap<>())
                .compute(cellKey, (key, current) -> {
                    long count = current == null ? 0 : current.count();
                    Acquisition recorded = acquisitions.get(acquisitionKey);
                    if (recorded != null) {
                        result.set(recorded.rolledBack()
                                ? IncrementResult.rejected(count)
                                : IncrementResult.acquired(recorded.count()));
                        return current;
                    }
                    if (count < cap) {
                        acquisitions.put(acquisitionKey, new Acquisition(count + 1, false, now().plus(operationTtl)));
                        result.set(IncrementResult.acquired(count + 1));
                        return new QuotaCounter(researchId, key, count + 1, cap, now());
                    }
                    result.set(IncrementResult.rejected(count));
                    return current != null ? current : new QuotaCounter(researchId, key, 0, cap, now());
                });

        Instant now = now();
        acquisitions.values().removeIf(acquisition -> acquisition.expiresAt().isBefore(now));
        return result.get();
    }

    @Override
    public long decrement(String researchId, String cellKey, String operationId) {
        Map<String, QuotaCounter> counters = countersByResearch.get(researchId);
        Map<String, Acquisition> acquisitions = acquisitionsByResearch.get(researchId);
        if (counters == null) {
            return 0;
        }
        if (acquisitions == null) {
            QuotaCounter current = counters.get(cellKey);
            return current == null ? 0 : current.count();
        }

        String acquisitionKey = acquisitionKey(operationId, cellKey);
        QuotaCounter updated = counters.computeIfPresent(cellKey, (key, current) -> {
            Acquisition recorded = acquisitions.get(acquisitionKey);
            if (recorded == null || recorded.rolledBack()) {
                return current;
            }
            acquisitions.put(acquisitionKey, recorded.markRolledBack());
            return current.count() > 0
                    ? new QuotaCounter(researchId, key, current.count() - 1, current.cap(), now())
                    : current;
        });
        return updated == null ? 0 : updated.count();
    }

    @Override
    public List<QuotaCounter> findAll(String researchId) {
        return countersByResearch.getOrDefault(researchId, Map.of()).values().stream()
                .sorted(Comparator.comparing(QuotaCounter::cellKey))
                .toList();
    }

    @Override
    public int resetAll(String researchId) {
        Map<String, QuotaCounter> cells = countersByResearch.get(researchId);
        if (cells == null) {
            return 0;
        }
        int reset = 0;
        // Cell by cell; a concurrent validate may observe a mix of old and zeroed counters.
        for (String cellKey : cells.keySet()) {
            cells.computeIfPresent(cellKey, (key, current) ->
                    new QuotaCounter(researchId, key, 0, current.cap(), now()));
            reset++;
        }
        log.debug("Reset {} in-memory counters for research {}", reset, researchId);
        return reset;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    /**
     * Visible for tests: whether any state is held for the research study.
     */
    boolean holdsState(String researchId) {
        return countersByResearch.containsKey(researchId) || acquisitionsByResearch.containsKey(researchId);
    }

    private static String acquisitionKey(String operationId, String cellKey) {
        return operationId + ":" + cellKey;
    }

    private Instant now() {
        return clock.instant();
    }

    private record Acquisition(long count, boolean rolledBack, Instant expiresAt) {

        Acquisition markRolledBack() {
            return new Acquisition(count, true, expiresAt);
        }
    }
}
