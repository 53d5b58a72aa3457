package ru.tigran.quotaadmission.dto;

import java.time.Instant;

/**
 * Fill level of one quota cell.
 */
public record QuotaCellStats(
        String cellKey,
        String dimension,
        String value,
        long count,
        int cap,
        long remaining,
        double percent,
        Instant updatedAt
) {
}
