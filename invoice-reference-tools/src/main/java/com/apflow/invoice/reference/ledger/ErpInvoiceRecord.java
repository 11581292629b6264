package com.apflow.invoice.reference.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Invoice posted to the ledger.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErpInvoiceRecord {
    private String recordId;
    private String idempotencyKey;
    private String supplierId;
    private String poNumber;
    private String invoiceNumber;
    private LocalDate invoiceDate;
    private BigDecimal netAmount;
    private BigDecimal taxAmount;
    private BigDecimal totalAmount;
    private String currency;
    private String status;
    private Instant createdAt;
}
