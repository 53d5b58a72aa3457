package ru.tigran.quotaadmission.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO для сброса счётчиков исследования.
 * confirmReset должен быть true, иначе запрос отклоняется без изменений.
 */
public record QuotaResetRequest(
        @NotBlank(message = "researchId is required")
        String researchId,

        Boolean confirmReset
) {
}
