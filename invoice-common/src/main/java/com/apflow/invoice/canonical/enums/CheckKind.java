package com.apflow.invoice.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reference-data checks applied to an extracted invoice.
 *
 * Declaration order is the evaluation order used by the confidence aggregator.
 */
public enum CheckKind {
    TAX_ID("TAX_ID", "taxId"),
    NATIONAL_ID("NATIONAL_ID", "nationalId"),
    BANK_ACCOUNT("BANK_ACCOUNT", "bankAccountNumber"),
    PURCHASE_ORDER("PURCHASE_ORDER", "purchaseOrderRef");

    private final String value;
    private final String fieldName;

    CheckKind(String value, String fieldName) {
        this.value = value;
        this.fieldName = fieldName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Name of the extracted field this check verifies.
     */
    public String getFieldName() {
        return fieldName;
    }
}
