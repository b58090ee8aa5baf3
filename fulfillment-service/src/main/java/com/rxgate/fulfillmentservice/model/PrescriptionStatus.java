package com.rxgate.fulfillmentservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum PrescriptionStatus {
    PENDING,
    VERIFIED,
    REJECTED,
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Request binding accepts any case ("verified", "Rejected").
     */
    @JsonCreator
    public static PrescriptionStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        return PrescriptionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
