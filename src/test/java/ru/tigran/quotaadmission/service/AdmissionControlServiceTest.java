package ru.tigran.quotaadmission.service;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import ru.tigran.quotaadmission.counter.InMemoryQuotaCounterStore;
import ru.tigran.quotaadmission.counter.IncrementResult;
import ru.tigran.quotaadmission.counter.QuotaCounter;
import ru.tigran.quotaadmission.counter.QuotaCounterStore;
import ru.tigran.quotaadmission.dto.CombinationMode;
import ru.tigran.quotaadmission.dto.CompositeCapPolicy;
import ru.tigran.quotaadmission.dto.QuotaConfig;
import ru.tigran.quotaadmission.dto.QuotaDimension;
import ru.tigran.quotaadmission.dto.QuotaRuleDTO;
import ru.tigran.quotaadmission.dto.ValidationResult;
import ru.tigran.quotaadmission.dto.ValidationStatus;
import ru.tigran.quotaadmission.exception.StoreUnavailableException;
import ru.tigran.quotaadmission.exception.ValidationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit-тесты для AdmissionControlService.
 * Тестирует допуск, откат частичных инкрементов и поведение при сбоях хранилища.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AdmissionControlService unit тесты")
class AdmissionControlServiceTest {

    private static final String RESEARCH_ID = "research-1";
    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    private static final String AGE_CELL = "AGE=18-24";
    private static final String COUNTRY_CELL = "COUNTRY=ES";
    private static final String GENDER_CELL = "GENDER=female";

    @Mock
    private QuotaConfigService quotaConfigService;

    @Mock
    private QuotaCounterStore mockStore;

    private MeterRegistry meterRegistry;
    private InMemoryQuotaCounterStore memoryStore;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        memoryStore = new InMemoryQuotaCounterStore(FIXED_CLOCK);
    }

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    private AdmissionControlService service(QuotaCounterStore store, Clock clock) {
        return new AdmissionControlService(
                quotaConfigService,
                new QuotaCellMatcher(CompositeCapPolicy.MIN),
                store,
                testRetry("store"),
                testRetry("rollback"),
                clock,
                meterRegistry,
                3000
        );
    }

    private static Retry testRetry(String name) {
        return Retry.of(name, RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(StoreUnavailableException.class)
                .build());
    }

    private void givenConfig(CombinationMode mode, QuotaRuleDTO... rules) {
        when(quotaConfigService.findConfig(RESEARCH_ID))
                .thenReturn(Optional.of(new QuotaConfig(RESEARCH_ID, mode, true, List.of(rules), null)));
    }

    private long count(String cellKey) {
        return memoryStore.findAll(RESEARCH_ID).stream()
                .filter(counter -> counter.cellKey().equals(cellKey))
                .mapToLong(QuotaCounter::count)
                .findFirst()
                .orElse(0);
    }

    private static Map<String, String> participant() {
        return Map.of("age", "18-24", "country", "ES", "gender", "female");
    }

    @Test
    @DisplayName("validate - третий участник при cap = 2 получает OVERQUOTA, счётчик остаётся 2")
    void validateRejectsParticipantAboveCap() {
        givenConfig(CombinationMode.PER_DIMENSION, new QuotaRuleDTO(QuotaDimension.AGE, "18-24", 2));
        AdmissionControlService service = service(memoryStore, FIXED_CLOCK);

        ValidationResult first = service.validate(RESEARCH_ID, Map.of("age", "18-24"));
        ValidationResult second = service.validate(RESEARCH_ID, Map.of("age", "18-24"));
        ValidationResult third = service.validate(RESEARCH_ID, Map.of("age", "18-24"));

        assertEquals(ValidationStatus.QUALIFIED, first.status());
        assertEquals(1, first.matchedCells().get(0).count());
        assertEquals(ValidationStatus.QUALIFIED, second.status());
        assertEquals(2, second.matchedCells().get(0).count());
        assertEquals(0, second.matchedCells().get(0).remaining());

        assertEquals(ValidationStatus.OVERQUOTA, third.status());
        assertNotNull(third.exhaustedCell());
        assertEquals(AGE_CELL, third.exhaustedCell().cellKey());
        assertEquals(2, third.exhaustedCell().count());
        assertEquals(2, third.exhaustedCell().cap());
        assertEquals("Quota reached for " + AGE_CELL, third.reason());
        assertEquals(2, count(AGE_CELL));
    }

    @Test
    @DisplayName("validate - CROSS_PRODUCT использует минимальный cap составной ячейки")
    void validateCrossProductUsesCompositeCap() {
        givenConfig(CombinationMode.CROSS_PRODUCT,
                new QuotaRuleDTO(QuotaDimension.AGE, "18-24", 5),
                new QuotaRuleDTO(QuotaDimension.COUNTRY, "ES", 1));
        AdmissionControlService service = service(memoryStore, FIXED_CLOCK);
        Map<String, String> demographics = Map.of("age", "18-24", "country", "ES");

        ValidationResult first = service.validate(RESEARCH_ID, demographics);
        ValidationResult second = service.validate(RESEARCH_ID, demographics);

        assertEquals(ValidationStatus.QUALIFIED, first.status());
        assertEquals(1, first.matchedCells().size());
        assertEquals("AGE=18-24&COUNTRY=ES", first.matchedCells().get(0).cellKey());
        assertEquals("AGE&COUNTRY", first.matchedCells().get(0).dimension());
        assertEquals(1, first.matchedCells().get(0).cap());

        assertEquals(ValidationStatus.OVERQUOTA, second.status());
        assertEquals(1, count("AGE=18-24&COUNTRY=ES"));
        assertEquals(0, count(AGE_CELL));
    }

    @Test
    @DisplayName("validate - отказ по одной ячейке откатывает уже выполненные инкременты")
    void validateIsAllOrNothing() {
        givenConfig(CombinationMode.PER_DIMENSION,
                new QuotaRuleDTO(QuotaDimension.AGE, "18-24", 5),
                new QuotaRuleDTO(QuotaDimension.COUNTRY, "ES", 0));
        AdmissionControlService service = service(memoryStore, FIXED_CLOCK);

        ValidationResult result = service.validate(RESEARCH_ID, participant());

        assertEquals(ValidationStatus.OVERQUOTA, result.status());
        assertEquals(COUNTRY_CELL, result.exhaustedCell().cellKey());
        assertEquals(2, result.matchedCells().size());
        assertEquals(AGE_CELL, result.matchedCells().get(0).cellKey());
        assertEquals(0, result.matchedCells().get(0).count());
        assertEquals(0, count(AGE_CELL));
        assertEquals(0, count(COUNTRY_CELL));
    }

    @Test
    @DisplayName("validate - допущенный участник учитывается во всех подходящих ячейках")
    void validateQualifiesIntoEveryMatchedCell() {
        givenConfig(CombinationMode.PER_DIMENSION,
                new QuotaRuleDTO(QuotaDimension.AGE, "18-24", 5),
                new QuotaRuleDTO(QuotaDimension.AGE, "25-34", 5),
                new QuotaRuleDTO(QuotaDimension.GENDER, "female", 3));
        AdmissionControlService service = service(memoryStore, FIXED_CLOCK);

        ValidationResult result = service.validate(RESEARCH_ID, participant());

        assertEquals(ValidationStatus.QUALIFIED, result.status());
        assertEquals(List.of(AGE_CELL, GENDER_CELL),
                result.matchedCells().stream().map(cell -> cell.cellKey()).toList());
        assertEquals(Instant.parse("2026-01-15T10:00:00Z"), result.timestamp());
        assertNull(result.exhaustedCell());
        assertEquals(1, count(AGE_CELL));
        assertEquals(1, count(GENDER_CELL));
        assertEquals(0, count("AGE=25-34"));
    }

    @Test
    @DisplayName("validate - без конфигурации участник пропускается без обращения к хранилищу")
    void validatePassesThroughWithoutConfig() {
        when(quotaConfigService.findConfig(RESEARCH_ID)).thenReturn(Optional.empty());
        AdmissionControlService service = service(mockStore, FIXED_CLOCK);

        ValidationResult result = service.validate(RESEARCH_ID, participant());

        assertEquals(ValidationStatus.NO_CONFIG, result.status());
        assertTrue(result.matchedCells().isEmpty());
        verifyNoInteractions(mockStore);
    }

    @Test
    @DisplayName("validate - выключенные квоты дают NO_CONFIG")
    void validatePassesThroughWhenDisabled() {
        when(quotaConfigService.findConfig(RESEARCH_ID)).thenReturn(Optional.of(new QuotaConfig(
                RESEARCH_ID, CombinationMode.PER_DIMENSION, false,
                List.of(new QuotaRuleDTO(QuotaDimension.AGE, "18-24", 0)), null)));
        AdmissionControlService service = service(mockStore, FIXED_CLOCK);

        ValidationResult result = service.validate(RESEARCH_ID, participant());

        assertEquals(ValidationStatus.NO_CONFIG, result.status());
        verifyNoInteractions(mockStore);
    }

    @Test
    @DisplayName("validate - участник вне всех правил получает NO_CONFIG")
    void validatePassesThroughWhenNoRuleMatches() {
        givenConfig(CombinationMode.PER_DIMENSION, new QuotaRuleDTO(QuotaDimension.AGE, "65+", 1));
        AdmissionControlService service = service(mockStore, FIXED_CLOCK);

        ValidationResult result = service.validate(RESEARCH_ID, participant());

        assertEquals(ValidationStatus.NO_CONFIG, result.status());
        verifyNoInteractions(mockStore);
    }

    @Test
    @DisplayName("validate - пустой researchId отклоняется до обращения к хранилищам")
    void validateRejectsBlankResearchId() {
        AdmissionControlService service = service(mockStore, FIXED_CLOCK);

        assertThrows(ValidationException.class, () -> service.validate("  ", participant()));
        assertThrows(ValidationException.class, () -> service.validate(RESEARCH_ID, null));
        verifyNoInteractions(quotaConfigService, mockStore);
    }

    @Test
    @DisplayName("validate - недоступная БД конфигураций даёт ERROR")
    void validateReturnsErrorWhenConfigStoreFails() {
        when(quotaConfigService.findConfig(RESEARCH_ID))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
        AdmissionControlService service = service(mockStore, FIXED_CLOCK);

        ValidationResult result = service.validate(RESEARCH_ID, participant());

        assertEquals(ValidationStatus.ERROR, result.status());
        verifyNoInteractions(mockStore);
    }

    @Test
    @DisplayName("validate - временный сбой хранилища повторяется и не мешает допуску")
    void validateRetriesTransientStoreFailure() {
        givenConfig(CombinationMode.PER_DIMENSION, new QuotaRuleDTO(QuotaDimension.AGE, "18-24", 5));
        when(mockStore.incrementIfBelowCap(eq(RESEARCH_ID), eq(AGE_CELL), eq(5), anyString()))
                .thenThrow(new StoreUnavailableException("timeout"))
                .thenReturn(IncrementResult.acquired(1));
        AdmissionControlService service = service(mockStore, FIXED_CLOCK);

        ValidationResult result = service.validate(RESEARCH_ID, participant());

        assertEquals(ValidationStatus.QUALIFIED, result.status());
        ArgumentCaptor<String> operations = ArgumentCaptor.forClass(String.class);
        verify(mockStore, times(2)).incrementIfBelowCap(eq(RESEARCH_ID), eq(AGE_CELL), eq(5), operations.capture());
        assertEquals(operations.getAllValues().get(0), operations.getAllValues().get(1));
    }

    @Test
    @DisplayName("validate - недоступное хранилище: откат выполненных инкрементов и ERROR")
    void validateRollsBackWhenStoreUnavailable() {
        givenConfig(CombinationMode.PER_DIMENSION,
                new QuotaRuleDTO(QuotaDimension.AGE, "18-24", 5),
                new QuotaRuleDTO(QuotaDimension.COUNTRY, "ES", 5));
        when(mockStore.incrementIfBelowCap(eq(RESEARCH_ID), eq(AGE_CELL), eq(5), anyString())).thenReturn(IncrementResult.acquired(1));
        when(mockStore.incrementIfBelowCap(eq(RESEARCH_ID), eq(COUNTRY_CELL), eq(5), anyString()))
                .thenThrow(new StoreUnavailableException("connection reset"));
        AdmissionControlService service = service(mockStore, FIXED_CLOCK);

        ValidationResult result = service.validate(RESEARCH_ID, participant());

        assertEquals(ValidationStatus.ERROR, result.status());
        verify(mockStore, times(3)).incrementIfBelowCap(eq(RESEARCH_ID), eq(COUNTRY_CELL), eq(5), anyString());
        // исход инкремента COUNTRY неизвестен, поэтому он тоже откатывается, первым
        InOrder rollbackOrder = inOrder(mockStore);
        rollbackOrder.verify(mockStore).decrement(eq(RESEARCH_ID), eq(COUNTRY_CELL), anyString());
        rollbackOrder.verify(mockStore).decrement(eq(RESEARCH_ID), eq(AGE_CELL), anyString());
    }

    @Test
    @DisplayName("validate - сбой отката: остальные ячейки всё равно откатываются, решение ERROR")
    void validateContinuesRollbackAfterDecrementFailure() {
        givenConfig(CombinationMode.PER_DIMENSION,
                new QuotaRuleDTO(QuotaDimension.AGE, "18-24", 5),
                new QuotaRuleDTO(QuotaDimension.COUNTRY, "ES", 5),
                new QuotaRuleDTO(QuotaDimension.GENDER, "female", 1));
        when(mockStore.incrementIfBelowCap(eq(RESEARCH_ID), eq(AGE_CELL), eq(5), anyString())).thenReturn(IncrementResult.acquired(1));
        when(mockStore.incrementIfBelowCap(eq(RESEARCH_ID), eq(COUNTRY_CELL), eq(5), anyString())).thenReturn(IncrementResult.acquired(1));
        when(mockStore.incrementIfBelowCap(eq(RESEARCH_ID), eq(GENDER_CELL), eq(1), anyString())).thenReturn(IncrementResult.rejected(1));
        when(mockStore.decrement(eq(RESEARCH_ID), eq(COUNTRY_CELL), anyString())).thenThrow(new StoreUnavailableException("down"));
        when(mockStore.decrement(eq(RESEARCH_ID), eq(AGE_CELL), anyString())).thenReturn(0L);
        AdmissionControlService service = service(mockStore, FIXED_CLOCK);

        ValidationResult result = service.validate(RESEARCH_ID, participant());

        assertEquals(ValidationStatus.ERROR, result.status());
        verify(mockStore, times(3)).decrement(eq(RESEARCH_ID), eq(COUNTRY_CELL), anyString());
        verify(mockStore).decrement(eq(RESEARCH_ID), eq(AGE_CELL), anyString());
        assertEquals(1.0, meterRegistry.get("quota.rollback.failures").counter().count());
    }

    @Test
    @DisplayName("validate - повтор после потерянного ответа не занимает второе место в ячейке")
    void validateDoesNotCountRetriedIncrementTwice() {
        givenConfig(CombinationMode.PER_DIMENSION, new QuotaRuleDTO(QuotaDimension.AGE, "18-24", 2));
        QuotaCounterStore store = new InterceptingStore(memoryStore, (call, increment) -> {
            IncrementResult applied = increment.get();
            if (call == 1) {
                throw new StoreUnavailableException("reply lost");
            }
            return applied;
        });
        AdmissionControlService service = service(store, FIXED_CLOCK);

        ValidationResult first = service.validate(RESEARCH_ID, Map.of("age", "18-24"));
        ValidationResult second = service.validate(RESEARCH_ID, Map.of("age", "18-24"));

        assertEquals(ValidationStatus.QUALIFIED, first.status());
        assertEquals(1, first.matchedCells().get(0).count());
        assertEquals(ValidationStatus.QUALIFIED, second.status());
        assertEquals(2, second.matchedCells().get(0).count());
        assertEquals(2, count(AGE_CELL));
    }

    @Test
    @DisplayName("validate - инкремент применён, но все попытки упали: ERROR без утечки счётчика")
    void validateRollsBackIncrementWithUnknownOutcome() {
        givenConfig(CombinationMode.PER_DIMENSION,
                new QuotaRuleDTO(QuotaDimension.AGE, "18-24", 5),
                new QuotaRuleDTO(QuotaDimension.COUNTRY, "ES", 5));
        QuotaCounterStore store = new InterceptingStore(memoryStore, (call, increment) -> {
            IncrementResult applied = increment.get();
            if (call > 1) {
                throw new StoreUnavailableException("reply lost");
            }
            return applied;
        });
        AdmissionControlService service = service(store, FIXED_CLOCK);

        ValidationResult result = service.validate(RESEARCH_ID, participant());

        assertEquals(ValidationStatus.ERROR, result.status());
        assertEquals("Quota counter store unavailable", result.reason());
        assertEquals(0, count(AGE_CELL));
        assertEquals(0, count(COUNTRY_CELL));
    }

    @Test
    @DisplayName("validate - deadline проверяется перед каждой повторной попыткой")
    void validateStopsRetryingAfterDeadline() {
        givenConfig(CombinationMode.PER_DIMENSION, new QuotaRuleDTO(QuotaDimension.AGE, "18-24", 5));
        MutableClock clock = new MutableClock();
        InterceptingStore store = new InterceptingStore(memoryStore, (call, increment) -> {
            clock.advance(Duration.ofSeconds(2));
            if (call < 3) {
                throw new StoreUnavailableException("timeout");
            }
            return increment.get();
        });
        AdmissionControlService service = service(store, clock);

        ValidationResult result = service.validate(RESEARCH_ID, participant());

        assertEquals(ValidationStatus.ERROR, result.status());
        assertEquals("Validation deadline exceeded", result.reason());
        assertEquals(2, store.calls());
        assertEquals(0, count(AGE_CELL));
    }

    @Test
    @DisplayName("validate - deadline, истёкший во время последнего инкремента, откатывает допуск")
    void validateRollsBackWhenLastAcquisitionEndsPastDeadline() {
        givenConfig(CombinationMode.PER_DIMENSION,
                new QuotaRuleDTO(QuotaDimension.AGE, "18-24", 5),
                new QuotaRuleDTO(QuotaDimension.COUNTRY, "ES", 5));
        MutableClock clock = new MutableClock();
        QuotaCounterStore store = new InterceptingStore(memoryStore, (call, increment) -> {
            IncrementResult applied = increment.get();
            if (call == 2) {
                clock.advance(Duration.ofSeconds(4));
            }
            return applied;
        });
        AdmissionControlService service = service(store, clock);

        ValidationResult result = service.validate(RESEARCH_ID, participant());

        assertEquals(ValidationStatus.ERROR, result.status());
        assertEquals("Validation deadline exceeded", result.reason());
        assertEquals(0, count(AGE_CELL));
        assertEquals(0, count(COUNTRY_CELL));
    }

    @Test
    @DisplayName("validate - общий лимит участников: ячейка __TOTAL__ захватывается первой")
    void validateEnforcesParticipantLimit() {
        when(quotaConfigService.findConfig(RESEARCH_ID)).thenReturn(Optional.of(new QuotaConfig(
                RESEARCH_ID, CombinationMode.PER_DIMENSION, true,
                List.of(new QuotaRuleDTO(QuotaDimension.AGE, "18-24", 5)), 1)));
        AdmissionControlService service = service(memoryStore, FIXED_CLOCK);

        ValidationResult first = service.validate(RESEARCH_ID, participant());
        ValidationResult second = service.validate(RESEARCH_ID, participant());

        assertEquals(ValidationStatus.QUALIFIED, first.status());
        assertEquals(List.of("__TOTAL__", AGE_CELL),
                first.matchedCells().stream().map(cell -> cell.cellKey()).toList());
        assertEquals(ValidationStatus.OVERQUOTA, second.status());
        assertEquals("__TOTAL__", second.exhaustedCell().cellKey());
        assertEquals(1, count("__TOTAL__"));
        assertEquals(1, count(AGE_CELL));
    }

    @Test
    @DisplayName("validate - превышение deadline откатывает выполненные инкременты")
    void validateRollsBackWhenDeadlineExceeded() {
        givenConfig(CombinationMode.PER_DIMENSION,
                new QuotaRuleDTO(QuotaDimension.AGE, "18-24", 5),
                new QuotaRuleDTO(QuotaDimension.COUNTRY, "ES", 5));
        // каждый вызов instant() сдвигает время на 2 секунды при deadline 3 секунды
        AdmissionControlService service = service(memoryStore, new SteppingClock(Duration.ofSeconds(2)));

        ValidationResult result = service.validate(RESEARCH_ID, participant());

        assertEquals(ValidationStatus.ERROR, result.status());
        assertEquals("Validation deadline exceeded", result.reason());
        assertEquals(0, count(AGE_CELL));
        assertEquals(0, count(COUNTRY_CELL));
    }

    @Test
    @DisplayName("validate - прерывание потока откатывает инкременты и сохраняет флаг interrupt")
    void validateRollsBackWhenInterrupted() {
        givenConfig(CombinationMode.PER_DIMENSION,
                new QuotaRuleDTO(QuotaDimension.AGE, "18-24", 5),
                new QuotaRuleDTO(QuotaDimension.COUNTRY, "ES", 5));
        when(mockStore.incrementIfBelowCap(eq(RESEARCH_ID), eq(AGE_CELL), eq(5), anyString())).thenAnswer(invocation -> {
            Thread.currentThread().interrupt();
            return IncrementResult.acquired(1);
        });
        when(mockStore.decrement(eq(RESEARCH_ID), eq(AGE_CELL), anyString())).thenAnswer(invocation -> {
            assertFalse(Thread.currentThread().isInterrupted(), "rollback must run with the interrupt held back");
            return 0L;
        });
        AdmissionControlService service = service(mockStore, FIXED_CLOCK);

        ValidationResult result = service.validate(RESEARCH_ID, participant());

        assertEquals(ValidationStatus.ERROR, result.status());
        assertEquals("Validation cancelled", result.reason());
        verify(mockStore).decrement(eq(RESEARCH_ID), eq(AGE_CELL), anyString());
        verify(mockStore, never()).incrementIfBelowCap(eq(RESEARCH_ID), eq(COUNTRY_CELL), anyInt(), anyString());
        assertTrue(Thread.interrupted());
    }

    @Test
    @DisplayName("validate - метрики решений считаются по статусам")
    void validateRecordsDecisionMetrics() {
        givenConfig(CombinationMode.PER_DIMENSION, new QuotaRuleDTO(QuotaDimension.AGE, "18-24", 1));
        AdmissionControlService service = service(memoryStore, FIXED_CLOCK);

        service.validate(RESEARCH_ID, participant());
        service.validate(RESEARCH_ID, participant());

        assertEquals(1.0, meterRegistry.get("quota.validation.decisions").tag("status", "QUALIFIED").counter().count());
        assertEquals(1.0, meterRegistry.get("quota.validation.decisions").tag("status", "OVERQUOTA").counter().count());
        assertEquals(2, meterRegistry.get("quota.validation.duration").timer().count());
    }

    @Test
    @DisplayName("validate - демография с неизвестными ключами и пустыми значениями")
    void validateIgnoresUnknownKeysAndBlankValues() {
        givenConfig(CombinationMode.PER_DIMENSION, new QuotaRuleDTO(QuotaDimension.AGE, "18-24", 1));
        AdmissionControlService service = service(mockStore, FIXED_CLOCK);

        ValidationResult result = service.validate(RESEARCH_ID, Map.of("favouriteColour", "blue", "age", " "));

        assertEquals(ValidationStatus.NO_CONFIG, result.status());
        verify(mockStore, never()).incrementIfBelowCap(anyString(), anyString(), anyInt(), anyString());
    }

    /**
     * Обёртка над хранилищем: каждый инкремент проходит через interceptor с номером вызова.
     */
    private static final class InterceptingStore implements QuotaCounterStore {
        private final QuotaCounterStore delegate;
        private final IncrementInterceptor interceptor;
        private final AtomicInteger calls = new AtomicInteger();

        private InterceptingStore(QuotaCounterStore delegate, IncrementInterceptor interceptor) {
            this.delegate = delegate;
            this.interceptor = interceptor;
        }

        int calls() {
            return calls.get();
        }

        @Override
        public IncrementResult incrementIfBelowCap(String researchId, String cellKey, int cap, String operationId) {
            return interceptor.intercept(calls.incrementAndGet(),
                    () -> delegate.incrementIfBelowCap(researchId, cellKey, cap, operationId));
        }

        @Override
        public long decrement(String researchId, String cellKey, String operationId) {
            return delegate.decrement(researchId, cellKey, operationId);
        }

        @Override
        public List<QuotaCounter> findAll(String researchId) {
            return delegate.findAll(researchId);
        }

        @Override
        public int resetAll(String researchId) {
            return delegate.resetAll(researchId);
        }

        @Override
        public boolean isAvailable() {
            return delegate.isAvailable();
        }
    }

    @FunctionalInterface
    private interface IncrementInterceptor {
        IncrementResult intercept(int call, Supplier<IncrementResult> increment);
    }

    /**
     * Часы, которые двигаются только явно.
     */
    private static final class MutableClock extends Clock {
        private Instant current = Instant.parse("2026-01-15T10:00:00Z");

        void advance(Duration duration) {
            current = current.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return current;
        }
    }

    /**
     * Часы, которые сдвигаются на step при каждом чтении.
     */
    private static final class SteppingClock extends Clock {
        private final Duration step;
        private Instant current = Instant.parse("2026-01-15T10:00:00Z");

        private SteppingClock(Duration step) {
            this.step = step;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            Instant now = current;
            current = current.plus(step);
            return now;
        }
    }
}
