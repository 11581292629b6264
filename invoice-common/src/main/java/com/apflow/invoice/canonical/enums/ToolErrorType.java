package com.apflow.invoice.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ToolErrorType {
    UNAVAILABLE("UNAVAILABLE"),
    TIMEOUT("TIMEOUT"),
    PROTOCOL("PROTOCOL");

    private final String value;

    ToolErrorType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
