package com.rxgate.fulfillmentservice.model;

public enum ProviderStatus {
    PENDING,
    VERIFIED,
    SUSPENDED
}
