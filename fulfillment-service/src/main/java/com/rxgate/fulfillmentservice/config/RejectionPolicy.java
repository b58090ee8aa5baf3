package com.rxgate.fulfillmentservice.config;

/**
 * What happens to linked orders when their prescription is rejected.
 */
public enum RejectionPolicy {
    // order is cancelled for good
    CANCEL,
    // order goes back to PENDING_PRESCRIPTION and waits for a new upload
    RETRY
}
