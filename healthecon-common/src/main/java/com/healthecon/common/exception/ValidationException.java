package com.healthecon.common.exception;

/**
 * Raised for malformed query text, unknown bill references or bad paging input.
 * Always surfaced before any call to the reasoning service.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
