package ru.tigran.quotaadmission.dto;

import ru.tigran.quotaadmission.util.CellKeyUtils;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ячейка квоты - единица, по которой ведётся счётчик.
 * Одна ячейка соответствует одному правилу (PER_DIMENSION), набору правил (CROSS_PRODUCT)
 * или общему лимиту участников исследования (без правил).
 */
public record QuotaCell(
        String researchId,
        String cellKey,
        int cap,
        List<QuotaRuleDTO> rules
) {
    public QuotaCell {
        rules = List.copyOf(rules);
    }

    public static QuotaCell total(String researchId, int participantLimit) {
        return new QuotaCell(researchId, CellKeyUtils.TOTAL_KEY, participantLimit, List.of());
    }

    public String dimensionLabel() {
        if (rules.isEmpty()) {
            return CellKeyUtils.dimensionLabel(cellKey);
        }
        return rules.stream()
                .map(rule -> rule.dimension().name())
                .collect(Collectors.joining("&"));
    }

    public String valueLabel() {
        if (rules.isEmpty()) {
            return CellKeyUtils.valueLabel(cellKey);
        }
        return rules.stream()
                .map(QuotaRuleDTO::value)
                .collect(Collectors.joining("&"));
    }
}
