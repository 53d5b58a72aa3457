package ru.tigran.quotaadmission.counter;

import java.time.Instant;

/**
 * Stored state of one quota cell. count never exceeds cap.
 */
public record QuotaCounter(
        String researchId,
        String cellKey,
        long count,
        int cap,
        Instant updatedAt
) {
}
