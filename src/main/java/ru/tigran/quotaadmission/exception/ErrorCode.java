package ru.tigran.quotaadmission.exception;

/**
 * Enum for application error codes.
 * Centralizes all error code definitions to avoid magic strings.
 */
public enum ErrorCode {
    // Resource not found errors
    QUOTA_CONFIG_NOT_FOUND("QUOTA_CONFIG_NOT_FOUND", "Quota configuration not found"),

    // Validation errors
    VALIDATION_ERROR("VALIDATION_ERROR", "Validation failed"),
    RESET_NOT_CONFIRMED("RESET_NOT_CONFIRMED", "confirmReset must be true to reset quota counters"),
    DUPLICATE_QUOTA_RULE("DUPLICATE_QUOTA_RULE", "Duplicate quota rule for the same dimension and value"),

    // Counter store errors
    STORE_UNAVAILABLE("STORE_UNAVAILABLE", "Quota counter store is unavailable"),
    ROLLBACK_FAILED("ROLLBACK_FAILED", "Failed to roll back quota counter increments"),

    // Internal server errors
    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR", "An unexpected error occurred");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
