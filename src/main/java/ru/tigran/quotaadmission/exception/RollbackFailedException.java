package ru.tigran.quotaadmission.exception;

/**
 * Thrown when an increment acquired by a rejected validation could not be undone.
 * The affected counter is over-counted by one until reconciled out-of-band.
 */
public class RollbackFailedException extends ApplicationException {
    private final String researchId;
    private final String cellKey;

    public RollbackFailedException(String researchId, String cellKey, Throwable cause) {
        super("Failed to roll back increment of cell " + cellKey + " in research " + researchId,
                ErrorCode.ROLLBACK_FAILED.getCode(), true, cause);
        this.researchId = researchId;
        this.cellKey = cellKey;
    }

    public String getResearchId() {
        return researchId;
    }

    public String getCellKey() {
        return cellKey;
    }
}
