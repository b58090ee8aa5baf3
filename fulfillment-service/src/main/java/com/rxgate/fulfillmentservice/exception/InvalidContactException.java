package com.rxgate.fulfillmentservice.exception;

import com.rxgate.common.exception.InvalidInputException;

public class InvalidContactException extends InvalidInputException {

    public InvalidContactException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_CONTACT";
    }
}
