package com.rxgate.fulfillmentservice.model;

/**
 * MEDICATION offers are tracked by stock quantity, SERVICE offers (lab tests,
 * diagnostics) by an availability flag.
 */
public enum CatalogItemKind {
    MEDICATION,
    SERVICE;

    public boolean isStockable() {
        return this == MEDICATION;
    }
}
