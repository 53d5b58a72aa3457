package ru.tigran.quotaadmission.service;

import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import ru.tigran.quotaadmission.counter.IncrementResult;
import ru.tigran.quotaadmission.counter.QuotaCounterStore;
import ru.tigran.quotaadmission.dto.MatchedCell;
import ru.tigran.quotaadmission.dto.QuotaCell;
import ru.tigran.quotaadmission.dto.QuotaConfig;
import ru.tigran.quotaadmission.dto.QuotaDimension;
import ru.tigran.quotaadmission.dto.ValidationResult;
import ru.tigran.quotaadmission.dto.ValidationStatus;
import ru.tigran.quotaadmission.exception.ErrorCode;
import ru.tigran.quotaadmission.exception.RollbackFailedException;
import ru.tigran.quotaadmission.exception.StoreUnavailableException;
import ru.tigran.quotaadmission.exception.ValidationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Admission controller: decides whether a participant may enter a research study.
 *
 * <p>Protocol of one {@link #validate} call:
 * <ol>
 *     <li>load the quota configuration; none or disabled → NO_CONFIG</li>
 *     <li>match the participant's cells; none → NO_CONFIG</li>
 *     <li>acquire the cells one by one in match order with the store's conditional increment,
 *     all under one operation id so that a retried increment is never applied twice</li>
 *     <li>on the first full cell, store failure, deadline or interruption, undo every increment
 *     this call acquired and report OVERQUOTA or ERROR</li>
 * </ol>
 * The deadline is checked before every store attempt, retries included, and once more after each
 * acquisition; a call that runs past it is rolled back and reported as ERROR.
 * No partial admission is ever left behind for a rejected participant. The only shared state is
 * the counter store; correctness does not depend on any lock in this process.
 */
@Slf4j
@Service
public class AdmissionControlService {

    static final String RECONCILIATION_MARKER = "QUOTA_RECONCILIATION_REQUIRED";

    private final QuotaConfigService quotaConfigService;
    private final QuotaCellMatcher cellMatcher;
    private final QuotaCounterStore counterStore;
    private final Retry counterStoreRetry;
    private final Retry rollbackRetry;
    private final Clock clock;
    private final Duration validationDeadline;
    private final Map<ValidationStatus, Counter> decisionCounters = new EnumMap<>(ValidationStatus.class);
    private final Counter rollbackFailureCounter;
    private final Timer validationTimer;

    public AdmissionControlService(
            QuotaConfigService quotaConfigService,
            QuotaCellMatcher cellMatcher,
            QuotaCounterStore counterStore,
            @Qualifier("quotaCounterStoreRetry") Retry counterStoreRetry,
            @Qualifier("quotaRollbackRetry") Retry rollbackRetry,
            Clock clock,
            MeterRegistry meterRegistry,
            @Value("${app.quota.validation-deadline-ms:3000}") long validationDeadlineMs
    ) {
        this.quotaConfigService = quotaConfigService;
        this.cellMatcher = cellMatcher;
        this.counterStore = counterStore;
        this.counterStoreRetry = counterStoreRetry;
        this.rollbackRetry = rollbackRetry;
        this.clock = clock;
        this.validationDeadline = Duration.ofMillis(validationDeadlineMs);

        for (ValidationStatus status : ValidationStatus.values()) {
            decisionCounters.put(status, Counter.builder("quota.validation.decisions")
                    .description("Admission decisions by status")
                    .tag("status", status.name())
                    .register(meterRegistry));
        }
        this.rollbackFailureCounter = Counter.builder("quota.rollback.failures")
                .description("Increments that could not be rolled back and need reconciliation")
                .register(meterRegistry);
        this.validationTimer = Timer.builder("quota.validation.duration")
                .description("Duration of participant quota validation")
                .register(meterRegistry);
    }

    /**
     * Validates a participant against the quotas of a research study and, when admitted,
     * counts them in every matched cell.
     *
     * @param researchId   research study
     * @param demographics participant attributes; unknown keys and blank values are ignored
     * @return QUALIFIED, NO_CONFIG, OVERQUOTA or ERROR
     * @throws ValidationException if researchId or demographics is missing (no store is touched)
     */
    public ValidationResult validate(String researchId, Map<String, String> demographics) {
        if (researchId == null || researchId.isBlank()) {
            throw new ValidationException("researchId is required", ErrorCode.VALIDATION_ERROR.getCode());
        }
        if (demographics == null) {
            throw new ValidationException("demographics is required and must be an object",
                    ErrorCode.VALIDATION_ERROR.getCode());
        }

        ValidationResult result = validationTimer.record(() -> decide(researchId, demographics));
        decisionCounters.get(result.status()).increment();

        log.info("Quota validation completed for research {}: status={}, cells={}",
                researchId, result.status(), result.matchedCells().size());
        return result;
    }

    private ValidationResult decide(String researchId, Map<String, String> rawDemographics) {
        Instant deadline = clock.instant().plus(validationDeadline);

        Optional<QuotaConfig> config;
        try {
            config = quotaConfigService.findConfig(researchId);
        } catch (DataAccessException e) {
            log.error("Failed to load quota configuration for research {}", researchId, e);
            return ValidationResult.error(researchId, "Quota configuration unavailable", clock.instant());
        }

        if (config.isEmpty()) {
            log.debug("No quota configuration for research {}, passing participant through", researchId);
            return ValidationResult.noConfig(researchId, "No quota configuration for research", clock.instant());
        }
        if (!config.get().enabled()) {
            log.debug("Quotas disabled for research {}, passing participant through", researchId);
            return ValidationResult.noConfig(researchId, "Quotas are disabled for research", clock.instant());
        }

        Map<QuotaDimension, String> demographics = QuotaCellMatcher.normalize(rawDemographics);
        List<QuotaCell> cells = cellMatcher.match(demographics, config.get());
        if (cells.isEmpty()) {
            log.debug("No quota cell matches participant in research {}", researchId);
            return ValidationResult.noConfig(researchId, "No quota rule applies to participant", clock.instant());
        }

        return acquire(researchId, cells, deadline);
    }

    /**
     * Acquires cells strictly sequentially under one operation id. acquired holds the cells this call
     * incremented; a cell whose increment outcome is unknown (store failure after the call was sent)
     * is rolled back as well, which the store turns into a no-op if the increment never landed.
     */
    private ValidationResult acquire(String researchId, List<QuotaCell> cells, Instant deadline) {
        String operationId = UUID.randomUUID().toString();
        List<AcquiredCell> acquired = new ArrayList<>(cells.size());

        for (QuotaCell cell : cells) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Validation for research {} cancelled after acquiring {} of {} cells",
                        researchId, acquired.size(), cells.size());
                return rollbackAndFail(researchId, operationId, cellsOf(acquired), "Validation cancelled");
            }

            AtomicBoolean sent = new AtomicBoolean(false);
            IncrementResult increment;
            try {
                increment = counterStoreRetry.executeSupplier(() -> {
                    if (clock.instant().isAfter(deadline)) {
                        throw new DeadlineExceededException();
                    }
                    sent.set(true);
                    return counterStore.incrementIfBelowCap(researchId, cell.cellKey(), cell.cap(), operationId);
                });
            } catch (DeadlineExceededException e) {
                log.warn("Validation for research {} exceeded deadline of {}ms after acquiring {} of {} cells",
                        researchId, validationDeadline.toMillis(), acquired.size(), cells.size());
                return rollbackAndFail(researchId, operationId, withUncertain(acquired, cell, sent.get()),
                        "Validation deadline exceeded");
            } catch (StoreUnavailableException e) {
                log.error("Counter store unavailable while acquiring cell {} for research {}",
                        cell.cellKey(), researchId, e);
                return rollbackAndFail(researchId, operationId, withUncertain(acquired, cell, true),
                        "Quota counter store unavailable");
            }

            if (!increment.success()) {
                MatchedCell exhausted = MatchedCell.of(cell, increment.count());
                log.info("Cell {} of research {} is full ({}/{}), rejecting participant",
                        cell.cellKey(), researchId, increment.count(), cell.cap());
                try {
                    rollback(researchId, operationId, cellsOf(acquired));
                } catch (RollbackFailedException e) {
                    return rollbackFailed(researchId);
                }
                List<MatchedCell> reported = new ArrayList<>(acquired.size() + 1);
                acquired.forEach(previous -> reported.add(MatchedCell.of(previous.cell(), previous.count() - 1)));
                reported.add(exhausted);
                return ValidationResult.overquota(researchId, reported, exhausted, clock.instant());
            }

            acquired.add(new AcquiredCell(cell, increment.count()));

            if (clock.instant().isAfter(deadline)) {
                log.warn("Validation for research {} exceeded deadline of {}ms after acquiring {} of {} cells",
                        researchId, validationDeadline.toMillis(), acquired.size(), cells.size());
                return rollbackAndFail(researchId, operationId, cellsOf(acquired), "Validation deadline exceeded");
            }
        }

        List<MatchedCell> admitted = acquired.stream()
                .map(entry -> MatchedCell.of(entry.cell(), entry.count()))
                .toList();
        return ValidationResult.qualified(researchId, admitted, clock.instant());
    }

    private static List<QuotaCell> cellsOf(List<AcquiredCell> acquired) {
        return acquired.stream().map(AcquiredCell::cell).toList();
    }

    private static List<QuotaCell> withUncertain(List<AcquiredCell> acquired, QuotaCell cell, boolean sent) {
        List<QuotaCell> cells = new ArrayList<>(cellsOf(acquired));
        if (sent) {
            cells.add(cell);
        }
        return cells;
    }

    private ValidationResult rollbackAndFail(String researchId, String operationId, List<QuotaCell> cells,
                                             String reason) {
        try {
            rollback(researchId, operationId, cells);
        } catch (RollbackFailedException e) {
            return rollbackFailed(researchId);
        }
        return ValidationResult.error(researchId, reason, clock.instant());
    }

    private ValidationResult rollbackFailed(String researchId) {
        return ValidationResult.error(researchId,
                "Failed to roll back quota counters; possible over-admission", clock.instant());
    }

    /**
     * Undoes this call's increments in reverse acquisition order. Every cell is attempted even if an
     * earlier one fails; failures are logged for reconciliation and reported together.
     * A pending interrupt is held back until the rollback has finished.
     *
     * @throws RollbackFailedException if at least one decrement failed after bounded retry
     */
    private void rollback(String researchId, String operationId, List<QuotaCell> cells) {
        if (cells.isEmpty()) {
            return;
        }
        boolean interrupted = Thread.interrupted();
        RollbackFailedException failure = null;
        try {
            for (int i = cells.size() - 1; i >= 0; i--) {
                String cellKey = cells.get(i).cellKey();
                try {
                    rollbackRetry.executeSupplier(() -> counterStore.decrement(researchId, cellKey, operationId));
                    log.debug("Rolled back cell {} of research {}", cellKey, researchId);
                } catch (StoreUnavailableException e) {
                    rollbackFailureCounter.increment();
                    log.error("{}: research={} cell={} operation={} leakedIncrements=1 - rollback decrement failed",
                            RECONCILIATION_MARKER, researchId, cellKey, operationId, e);
                    if (failure == null) {
                        failure = new RollbackFailedException(researchId, cellKey, e);
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        if (failure != null) {
            throw failure;
        }
        log.info("Rolled back {} quota cells for research {}", cells.size(), researchId);
    }

    private record AcquiredCell(QuotaCell cell, long count) {
    }

    /**
     * Thrown inside the retried store call; not retried.
     */
    private static final class DeadlineExceededException extends RuntimeException {

        private DeadlineExceededException() {
            super("Validation deadline exceeded", null, false, false);
        }
    }
}
