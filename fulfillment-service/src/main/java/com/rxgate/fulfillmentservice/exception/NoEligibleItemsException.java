package com.rxgate.fulfillmentservice.exception;

public class NoEligibleItemsException extends RuntimeException {

    public NoEligibleItemsException(String message) {
        super(message);
    }
}
