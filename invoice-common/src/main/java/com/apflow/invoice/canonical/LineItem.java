package com.apflow.invoice.canonical;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Free-text invoice line. Line items have no reference check of their own.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LineItem {
    private String description;
    private BigDecimal quantity;
    private BigDecimal unitPrice;

    /**
     * Line total as printed on the invoice; may be missing.
     */
    private BigDecimal total;

    /**
     * Printed total when available, otherwise quantity x unit price, otherwise null.
     */
    public BigDecimal effectiveTotal() {
        if (total != null) {
            return total;
        }
        if (quantity != null && unitPrice != null) {
            return quantity.multiply(unitPrice);
        }
        return null;
    }
}
