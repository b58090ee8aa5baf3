package com.rxgate.fulfillmentservice.model;

/**
 * Prescription coverage of a single catalog item, as seen by a polling client.
 */
public enum CoverageStatus {
    NONE,
    PENDING,
    VERIFIED,
    REJECTED,
    EXPIRED;

    public static CoverageStatus of(PrescriptionStatus status) {
        return CoverageStatus.valueOf(status.name());
    }
}
