package com.apflow.invoice.orchestrator;

import com.apflow.invoice.canonical.ExtractedField;
import com.apflow.invoice.canonical.ExtractedInvoice;
import com.apflow.invoice.canonical.LineItem;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public final class TestInvoices {

    private TestInvoices() {
    }

    /**
     * Clean invoice from a registered supplier: every check matches and the amounts add up.
     */
    public static ExtractedInvoice technoVision(String submissionId, String invoiceNumber) {
        return ExtractedInvoice.builder()
            .submissionId(submissionId)
            .supplierName(ExtractedField.of("TechnoVision SAS", 0.99))
            .invoiceNumber(ExtractedField.of(invoiceNumber, 0.99))
            .taxId(ExtractedField.of("FR82123456789", 0.95))
            .nationalId(ExtractedField.of("12345678900014", 0.95))
            .bankAccountNumber(ExtractedField.of("FR7630006000011234567890189", 0.95))
            .bankRoutingCode(ExtractedField.of("BNPAFRPP", 0.95))
            .purchaseOrderRef(ExtractedField.of("PO-2025-001", 0.95))
            .invoiceDate(ExtractedField.of(LocalDate.of(2025, 2, 28), 0.95))
            .currency(ExtractedField.of("EUR", 0.99))
            .netAmount(ExtractedField.of(new BigDecimal("1000.00"), 0.95))
            .taxAmount(ExtractedField.of(new BigDecimal("200.00"), 0.95))
            .totalAmount(ExtractedField.of(new BigDecimal("1200.00"), 0.95))
            .lineItems(ExtractedField.of(List.of(
                LineItem.builder().description("Licences").quantity(new BigDecimal("2"))
                    .unitPrice(new BigDecimal("400.00")).build(),
                LineItem.builder().description("Support").total(new BigDecimal("200.00")).build()), 0.9))
            .build();
    }
}
