package com.alertaggregator.exception;

/**
 * Thrown when the alert store cannot be reached or its schema is unusable.
 *
 * <p>Always propagated to the caller of ingest and lifecycle operations: an alert that cannot
 * be persisted must not be reported as accepted.
 */
public class AlertStorageException extends BaseException {

    public AlertStorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, message, cause);
    }
}
