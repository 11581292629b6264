package com.apflow.invoice.rules;

import com.apflow.invoice.canonical.ExtractedField;
import com.apflow.invoice.canonical.ExtractedInvoice;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.apflow.invoice.rules.InvoiceFixtures.invoiceWithConfidence;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InvoiceBusinessRulesTest {

    private final InvoiceBusinessRules rules = new InvoiceBusinessRules(ValidationPolicy.defaults());

    @Test
    public void testConsistentInvoiceHasNoViolations() {
        assertTrue(rules.check(invoiceWithConfidence(0.9)).isEmpty());
    }

    @Test
    public void testTotalMismatchIsReported() {
        ExtractedInvoice invoice = invoiceWithConfidence(0.9).toBuilder()
            .totalAmount(ExtractedField.of(new BigDecimal("1250.00"), 0.9))
            .build();

        List<String> violations = rules.check(invoice);

        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("total amount (1250.00)"));
    }

    @Test
    public void testDifferenceWithinToleranceIsAccepted() {
        ExtractedInvoice invoice = invoiceWithConfidence(0.9).toBuilder()
            .totalAmount(ExtractedField.of(new BigDecimal("1200.01"), 0.9))
            .build();

        assertTrue(rules.check(invoice).isEmpty());
    }

    @Test
    public void testLineItemsMustAddUpToNet() {
        ExtractedInvoice invoice = invoiceWithConfidence(0.9).toBuilder()
            .netAmount(ExtractedField.of(new BigDecimal("900.00"), 0.9))
            .taxAmount(ExtractedField.of(new BigDecimal("300.00"), 0.9))
            .build();

        List<String> violations = rules.check(invoice);

        assertEquals(1, violations.size());
        assertTrue(violations.get(0).startsWith("sum of line items (1000.00)"));
    }

    @Test
    public void testMissingAmountsSkipTheRule() {
        ExtractedInvoice invoice = invoiceWithConfidence(0.9).toBuilder()
            .totalAmount(null)
            .lineItems(null)
            .build();

        assertTrue(rules.check(invoice).isEmpty());
    }
}
