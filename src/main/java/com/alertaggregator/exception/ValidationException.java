package com.alertaggregator.exception;

import java.util.Map;

/**
 * Rejects malformed caller input: unknown severity/status strings, alerts missing the fields
 * needed to fingerprint them, invalid query limits.
 *
 * <p>Unknown enum strings are never silently defaulted by the engine. Normalization layers that
 * want lenient behaviour must opt in explicitly (see {@code AlertCollector}).
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
