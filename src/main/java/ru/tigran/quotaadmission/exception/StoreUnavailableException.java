package ru.tigran.quotaadmission.exception;

/**
 * Thrown when the quota counter store cannot be reached or times out.
 * Always retriable: the failing operation is retried a bounded number of times with backoff.
 * HTTP status: 503 Service Unavailable
 */
public class StoreUnavailableException extends ApplicationException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, ErrorCode.STORE_UNAVAILABLE.getCode(), true, cause);
    }

    public StoreUnavailableException(String message) {
        super(message, ErrorCode.STORE_UNAVAILABLE.getCode(), true);
    }
}
