package com.apflow.invoice.tools;

/**
 * Wire names of the reference tools.
 */
public final class ToolNames {

    public static final String VALIDATE_TAX_ID = "validate_tax_id";
    public static final String VALIDATE_NATIONAL_ID = "validate_national_id";
    public static final String VALIDATE_SUPPLIER_BANK = "validate_supplier_bank";
    public static final String VALIDATE_PURCHASE_ORDER = "validate_purchase_order";
    public static final String LOOKUP_SUPPLIER = "lookup_supplier";
    public static final String CREATE_INVOICE_RECORD = "create_invoice_record";

    private ToolNames() {
    }
}
