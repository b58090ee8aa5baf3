package com.rxgate.common.exception;

/**
 * Base type for rejected caller input that passed schema validation but
 * cannot be acted upon (bad coordinates, unusable contact, missing reason).
 * HTTP Status: 400 Bad Request
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Machine readable code returned to clients.
     */
    public String getErrorCode() {
        return "INVALID_INPUT";
    }
}
