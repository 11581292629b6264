package com.apflow.invoice.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tri-state business verdict for an invoice.
 */
public enum RoutingOutcome {
    PROCEED("PROCEED"),
    REJECT("REJECT"),
    MANUAL_REVIEW("MANUAL_REVIEW");

    private final String value;

    RoutingOutcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Outcomes that require a human to be told.
     */
    public boolean requiresNotification() {
        return this == REJECT || this == MANUAL_REVIEW;
    }
}
