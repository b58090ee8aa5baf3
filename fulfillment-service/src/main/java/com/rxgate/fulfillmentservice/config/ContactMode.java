package com.rxgate.fulfillmentservice.config;

public enum ContactMode {
    // at least one valid phone or email per prescription
    REQUIRED,
    // contact is notification metadata only
    OPTIONAL
}
