package com.apflow.invoice.reference.data;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PurchaseOrderStatus {
    OPEN("open", true),
    PARTIALLY_RECEIVED("partially_received", true),
    CLOSED("closed", false),
    CANCELLED("cancelled", false);

    private final String value;
    private final boolean receivable;

    PurchaseOrderStatus(String value, boolean receivable) {
        this.value = value;
        this.receivable = receivable;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether invoices may still be booked against an order in this status.
     */
    public boolean isReceivable() {
        return receivable;
    }
}
