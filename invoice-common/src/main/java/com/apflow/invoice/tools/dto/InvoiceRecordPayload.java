package com.apflow.invoice.tools.dto;

import com.apflow.invoice.canonical.LineItem;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Invoice data sent to the system of record, using the verified (canonical)
 * values where the reference system supplied them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InvoiceRecordPayload {
    @NotBlank
    private String invoiceNumber;

    @NotBlank
    private String supplierName;

    private String taxId;
    private String nationalId;
    private String accountNumber;
    private String routingCode;
    private String purchaseOrderRef;
    private LocalDate invoiceDate;
    private String currency;
    private BigDecimal netAmount;
    private BigDecimal taxAmount;
    private BigDecimal totalAmount;
    private List<LineItem> lineItems;
}
