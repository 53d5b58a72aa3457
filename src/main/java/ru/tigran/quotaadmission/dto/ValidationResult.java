package ru.tigran.quotaadmission.dto;

import java.time.Instant;
import java.util.List;

/**
 * Admission decision for one participant.
 *
 * @param status        one of QUALIFIED, NO_CONFIG, OVERQUOTA, ERROR
 * @param researchId    research study the participant was validated against
 * @param matchedCells  cells the participant was admitted into (QUALIFIED) or matched (OVERQUOTA)
 * @param exhaustedCell the full cell that caused OVERQUOTA, otherwise null
 * @param reason        human-readable explanation of the decision
 * @param timestamp     decision time
 */
public record ValidationResult(
        ValidationStatus status,
        String researchId,
        List<MatchedCell> matchedCells,
        MatchedCell exhaustedCell,
        String reason,
        Instant timestamp
) {
    public ValidationResult {
        matchedCells = matchedCells == null ? List.of() : List.copyOf(matchedCells);
    }

    public static ValidationResult qualified(String researchId, List<MatchedCell> cells, Instant timestamp) {
        return new ValidationResult(ValidationStatus.QUALIFIED, researchId, cells, null,
                "Participant admitted", timestamp);
    }

    public static ValidationResult noConfig(String researchId, String reason, Instant timestamp) {
        return new ValidationResult(ValidationStatus.NO_CONFIG, researchId, List.of(), null, reason, timestamp);
    }

    public static ValidationResult overquota(String researchId, List<MatchedCell> cells,
                                             MatchedCell exhausted, Instant timestamp) {
        return new ValidationResult(ValidationStatus.OVERQUOTA, researchId, cells, exhausted,
                "Quota reached for " + exhausted.cellKey(), timestamp);
    }

    public static ValidationResult error(String researchId, String reason, Instant timestamp) {
        return new ValidationResult(ValidationStatus.ERROR, researchId, List.of(), null, reason, timestamp);
    }
}
