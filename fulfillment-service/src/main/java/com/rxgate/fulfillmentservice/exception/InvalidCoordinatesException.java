package com.rxgate.fulfillmentservice.exception;

import com.rxgate.common.exception.InvalidInputException;

public class InvalidCoordinatesException extends InvalidInputException {

    public InvalidCoordinatesException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_COORDINATES";
    }
}
