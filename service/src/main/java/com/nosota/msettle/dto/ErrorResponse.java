package com.nosota.msettle.dto;

import java.time.Instant;

/**
 * Error body returned by {@link com.nosota.msettle.exception.GlobalExceptionHandler}.
 */
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        Instant timestamp
) {
    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(status, error, message, path, Instant.now());
    }
}
