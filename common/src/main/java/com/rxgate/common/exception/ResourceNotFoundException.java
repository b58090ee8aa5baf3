package com.rxgate.common.exception;

/**
 * Thrown when a prescription, order, catalog item or provider does not exist.
 * HTTP Status: 404 Not Found
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
