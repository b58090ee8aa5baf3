package com.rxgate.common.exception;

/**
 * Thrown when the caller lacks the role an operation needs.
 * HTTP Status: 403 Forbidden (set in GlobalExceptionHandler)
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
