package ru.tigran.quotaadmission.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request DTO для создания или замены конфигурации квот исследования.
 *
 * Constraints:
 * - rules: до 500 правил; пустой список допустим только вместе с participantLimit
 * - combinationMode: обязательное поле
 * - enabled: опциональное, по умолчанию true
 * - participantLimit: опциональный общий лимит участников исследования, не меньше 0
 */
public record QuotaConfigRequest(
        @NotNull(message = "Rules are required")
        @Size(max = 500, message = "Maximum 500 quota rules")
        List<@NotNull @Valid QuotaRuleDTO> rules,

        @NotNull(message = "Combination mode is required")
        CombinationMode combinationMode,

        Boolean enabled,

        @Min(value = 0, message = "Participant limit must not be negative")
        Integer participantLimit
) {
}
