package com.apflow.invoice.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Result of checking one extracted field against a reference system.
 */
public enum VerificationResult {
    MATCH("MATCH"),
    MISMATCH("MISMATCH"),
    NOT_FOUND("NOT_FOUND"),
    TOOL_ERROR("TOOL_ERROR");

    private final String value;

    VerificationResult(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * MISMATCH and NOT_FOUND are definitive failures; TOOL_ERROR is not.
     */
    public boolean isDefinitiveFailure() {
        return this == MISMATCH || this == NOT_FOUND;
    }
}
