package com.rxgate.fulfillmentservice.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an order across medication and lab/diagnostic fulfillment.
 */
public enum OrderStatus {
    PENDING,
    CONFIRMED,
    PROCESSING,
    SHIPPED,
    DELIVERED,
    READY_FOR_PICKUP,
    SAMPLE_COLLECTED,
    RESULT_READY,
    COMPLETED,
    CANCELLED,
    PENDING_PRESCRIPTION; // blocked on prescription review

    private static final Set<OrderStatus> TERMINAL = EnumSet.of(DELIVERED, COMPLETED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public static Set<OrderStatus> terminalStatuses() {
        return EnumSet.copyOf(TERMINAL);
    }
}
