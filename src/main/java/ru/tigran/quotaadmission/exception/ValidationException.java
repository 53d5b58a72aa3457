package ru.tigran.quotaadmission.exception;

/**
 * Thrown for invalid input rejected before any store access.
 * Examples: missing researchId, unconfirmed reset, duplicate rules in a quota configuration.
 * HTTP status: 400 Bad Request
 */
public class ValidationException extends ApplicationException {
    public ValidationException(String message, String errorCode) {
        super(message, errorCode);
    }

    public ValidationException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage(), errorCode.getCode());
    }
}
