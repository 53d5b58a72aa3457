package ru.tigran.quotaadmission.dto;

public record QuotaResetResponse(
        String researchId,
        int countersReset,
        String message
) {
}
