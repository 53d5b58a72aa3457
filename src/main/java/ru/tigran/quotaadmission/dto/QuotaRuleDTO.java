package ru.tigran.quotaadmission.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Правило квоты: допустимое значение измерения и максимальное число участников с этим значением.
 *
 * Constraints:
 * - dimension: обязательное поле
 * - value: обязательное, 1-200 символов
 * - cap: не меньше 0 (cap = 0 всегда отклоняет)
 * - active: опциональное, по умолчанию true
 */
public record QuotaRuleDTO(
        @NotNull(message = "Dimension is required")
        QuotaDimension dimension,

        @NotBlank(message = "Rule value must not be blank")
        @Size(max = 200, message = "Rule value must not exceed 200 characters")
        String value,

        @NotNull(message = "Cap is required")
        @Min(value = 0, message = "Cap must not be negative")
        Integer cap,

        Boolean active
) {
    public QuotaRuleDTO {
        if (active == null) {
            active = Boolean.TRUE;
        }
    }

    public QuotaRuleDTO(QuotaDimension dimension, String value, int cap) {
        this(dimension, value, cap, Boolean.TRUE);
    }
}
