package ru.tigran.quotaadmission.dto;

import java.util.List;

/**
 * Read-only snapshot of a research study's quota configuration, as consumed by the admission engine
 * and returned by the config endpoint. Rules keep the order in which they were configured.
 * participantLimit caps the study as a whole; null means no study-wide limit.
 */
public record QuotaConfig(
        String researchId,
        CombinationMode combinationMode,
        boolean enabled,
        List<QuotaRuleDTO> rules,
        Integer participantLimit
) {
    public QuotaConfig {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }
}
