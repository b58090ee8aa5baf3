package com.rxgate.fulfillmentservice.exception;

/**
 * The prescription has already left PENDING (decided by someone else, or expired).
 */
public class PrescriptionAlreadyProcessedException extends RuntimeException {

    public PrescriptionAlreadyProcessedException(String message) {
        super(message);
    }
}
