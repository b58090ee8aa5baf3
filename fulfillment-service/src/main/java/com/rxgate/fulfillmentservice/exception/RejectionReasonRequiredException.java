package com.rxgate.fulfillmentservice.exception;

import com.rxgate.common.exception.InvalidInputException;

public class RejectionReasonRequiredException extends InvalidInputException {

    public RejectionReasonRequiredException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "REASON_REQUIRED";
    }
}
