package ru.tigran.quotaadmission.dto;

/**
 * A cell reported back in a validation result, with its fill level as seen by this call.
 */
public record MatchedCell(
        String cellKey,
        String dimension,
        String value,
        long count,
        int cap,
        long remaining
) {
    public static MatchedCell of(QuotaCell cell, long count) {
        return new MatchedCell(
                cell.cellKey(),
                cell.dimensionLabel(),
                cell.valueLabel(),
                count,
                cell.cap(),
                Math.max(cell.cap() - count, 0)
        );
    }
}
