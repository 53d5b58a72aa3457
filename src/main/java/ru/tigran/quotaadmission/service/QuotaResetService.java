package ru.tigran.quotaadmission.service;

import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import ru.tigran.quotaadmission.counter.QuotaCounterStore;
import ru.tigran.quotaadmission.dto.QuotaResetResponse;
import ru.tigran.quotaadmission.exception.ErrorCode;
import ru.tigran.quotaadmission.exception.ValidationException;

/**
 * Административный сброс счётчиков исследования.
 * Конфигурация квот не меняется. Повторный сброс безопасен.
 */
@Slf4j
@Service
public class QuotaResetService {

    private final QuotaCounterStore counterStore;
    private final Retry counterStoreRetry;

    public QuotaResetService(
            QuotaCounterStore counterStore,
            @Qualifier("quotaCounterStoreRetry") Retry counterStoreRetry
    ) {
        this.counterStore = counterStore;
        this.counterStoreRetry = counterStoreRetry;
    }

    /**
     * @param researchId   ID исследования
     * @param confirmReset должно быть true; иначе ValidationException без обращения к хранилищу
     * @return количество обнулённых счётчиков
     */
    public QuotaResetResponse reset(String researchId, Boolean confirmReset) {
        if (researchId == null || researchId.isBlank()) {
            throw new ValidationException("researchId is required", ErrorCode.VALIDATION_ERROR.getCode());
        }
        if (!Boolean.TRUE.equals(confirmReset)) {
            log.warn("Quota reset for research {} rejected: not confirmed", researchId);
            throw new ValidationException(ErrorCode.RESET_NOT_CONFIRMED);
        }

        int reset = counterStoreRetry.executeSupplier(() -> counterStore.resetAll(researchId));
        log.info("Reset {} quota counters for research {}", reset, researchId);

        return new QuotaResetResponse(researchId, reset, "Quota counters reset for research " + researchId);
    }
}
