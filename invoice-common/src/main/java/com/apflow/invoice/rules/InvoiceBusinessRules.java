package com.apflow.invoice.rules;

import com.apflow.invoice.canonical.ExtractedInvoice;
import com.apflow.invoice.canonical.LineItem;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Arithmetic consistency checks on invoice amounts.
 *
 * A rule is only evaluated when every amount it needs was extracted.
 */
public class InvoiceBusinessRules {

    private final ValidationPolicy policy;

    public InvoiceBusinessRules(ValidationPolicy policy) {
        this.policy = policy;
    }

    /**
     * @return human-readable violations, empty when the invoice is consistent
     */
    public List<String> check(ExtractedInvoice invoice) {
        List<String> violations = new ArrayList<>();
        BigDecimal tolerance = policy.getAmountTolerance();

        if (invoice.getNetAmount().isPresent() && invoice.getTaxAmount().isPresent()
                && invoice.getTotalAmount().isPresent()) {
            BigDecimal expected = invoice.getNetAmount().getValue().add(invoice.getTaxAmount().getValue());
            BigDecimal total = invoice.getTotalAmount().getValue();
            if (expected.subtract(total).abs().compareTo(tolerance) > 0) {
                violations.add("net amount + tax amount (" + expected.toPlainString()
                    + ") does not equal total amount (" + total.toPlainString() + ")");
            }
        }

        List<LineItem> lines = invoice.lineItemsOrEmpty();
        if (!lines.isEmpty() && invoice.getNetAmount().isPresent()) {
            BigDecimal lineSum = sumLines(lines);
            BigDecimal net = invoice.getNetAmount().getValue();
            if (lineSum != null && lineSum.subtract(net).abs().compareTo(tolerance) > 0) {
                violations.add("sum of line items (" + lineSum.toPlainString()
                    + ") does not equal net amount (" + net.toPlainString() + ")");
            }
        }
        return violations;
    }

    private static BigDecimal sumLines(List<LineItem> lines) {
        BigDecimal sum = BigDecimal.ZERO;
        for (LineItem line : lines) {
            BigDecimal lineTotal = line.effectiveTotal();
            if (lineTotal == null) {
                return null;
            }
            sum = sum.add(lineTotal);
        }
        return sum;
    }
}
