package ru.tigran.quotaadmission.exception;

/**
 * Base exception class for all application-specific exceptions.
 * Carries an error code from {@link ErrorCode} and a retriable flag.
 *
 * Retriable exceptions indicate transient failures of a collaborator (counter store, config store)
 * that may succeed on a later attempt. Non-retriable exceptions are terminal.
 */
public abstract class ApplicationException extends RuntimeException {
    private final String errorCode;
    private final boolean retriable;

    protected ApplicationException(String message, String errorCode) {
        this(message, errorCode, false);
    }

    protected ApplicationException(String message, String errorCode, boolean retriable) {
        super(message);
        this.errorCode = errorCode;
        this.retriable = retriable;
    }

    protected ApplicationException(String message, String errorCode, boolean retriable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retriable = retriable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetriable() {
        return retriable;
    }
}
