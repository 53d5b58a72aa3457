package ru.tigran.quotaadmission.service;

import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import ru.tigran.quotaadmission.counter.QuotaCounter;
import ru.tigran.quotaadmission.counter.QuotaCounterStore;
import ru.tigran.quotaadmission.dto.QuotaCellStats;
import ru.tigran.quotaadmission.dto.QuotaStatsResponse;
import ru.tigran.quotaadmission.exception.ErrorCode;
import ru.tigran.quotaadmission.exception.ValidationException;
import ru.tigran.quotaadmission.util.CellKeyUtils;

import java.util.Comparator;
import java.util.List;

/**
 * Сервис статистики заполнения квот.
 * Снимок без блокировок: значения разных ячеек могут быть прочитаны в разные моменты.
 */
@Slf4j
@Service
public class QuotaStatsService {

    private final QuotaCounterStore counterStore;
    private final Retry counterStoreRetry;

    public QuotaStatsService(
            QuotaCounterStore counterStore,
            @Qualifier("quotaCounterStoreRetry") Retry counterStoreRetry
    ) {
        this.counterStore = counterStore;
        this.counterStoreRetry = counterStoreRetry;
    }

    /**
     * Возвращает заполнение всех ячеек исследования, отсортированных по cellKey.
     *
     * @param researchId ID исследования
     * @return статистика; пустой список ячеек, если ни один участник ещё не проверялся
     */
    public QuotaStatsResponse getStats(String researchId) {
        if (researchId == null || researchId.isBlank()) {
            throw new ValidationException("researchId is required", ErrorCode.VALIDATION_ERROR.getCode());
        }

        List<QuotaCounter> counters = counterStoreRetry.executeSupplier(() -> counterStore.findAll(researchId));
        List<QuotaCellStats> cells = counters.stream()
                .map(this::mapToStats)
                .sorted(Comparator.comparing(QuotaCellStats::cellKey))
                .toList();

        log.debug("Collected {} quota counters for research {}", cells.size(), researchId);
        return new QuotaStatsResponse(researchId, cells, cells.size());
    }

    /**
     * Маппинг QuotaCounter → QuotaCellStats.
     */
    private QuotaCellStats mapToStats(QuotaCounter counter) {
        return new QuotaCellStats(
                counter.cellKey(),
                CellKeyUtils.dimensionLabel(counter.cellKey()),
                CellKeyUtils.valueLabel(counter.cellKey()),
                counter.count(),
                counter.cap(),
                Math.max(counter.cap() - counter.count(), 0),
                percent(counter.count(), counter.cap()),
                counter.updatedAt()
        );
    }

    // Ячейка с cap = 0 всегда заполнена
    static double percent(long count, int cap) {
        if (cap <= 0) {
            return 100.0;
        }
        return Math.round(count * 10000.0 / cap) / 100.0;
    }
}
