package ru.tigran.quotaadmission.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Request DTO для проверки участника по квотам.
 * Ключи demographics - имена полей анкеты (age, country, ...) или имена измерений (AGE, COUNTRY, ...).
 * Неизвестные ключи игнорируются.
 */
public record QuotaValidationRequest(
        @NotBlank(message = "researchId is required")
        @Size(max = 200, message = "researchId must not exceed 200 characters")
        String researchId,

        @NotNull(message = "demographics is required and must be an object")
        Map<String, String> demographics
) {
}
