package com.apflow.invoice.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RunReportType {
    ACCEPTED("ACCEPTED"),
    REJECTION("REJECTION"),
    REVIEW_REQUIRED("REVIEW_REQUIRED"),
    FAILURE("FAILURE"),
    CANCELLED("CANCELLED");

    private final String value;

    RunReportType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
