package com.alertaggregator.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Caller-facing error categories. The HTTP status is a hint for binding layers that translate
 * engine failures into responses; the engine itself never formats responses.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    DUPLICATE_KEY("DUPLICATE_KEY", 409),
    STORAGE_ERROR("STORAGE_ERROR", 503);

    private final String code;
    private final int httpStatus;
}
