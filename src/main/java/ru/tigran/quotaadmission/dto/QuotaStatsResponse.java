package ru.tigran.quotaadmission.dto;

import java.util.List;

public record QuotaStatsResponse(
        String researchId,
        List<QuotaCellStats> cells,
        int totalCounters
) {
}
