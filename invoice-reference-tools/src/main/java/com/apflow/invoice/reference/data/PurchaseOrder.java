package com.apflow.invoice.reference.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PurchaseOrder {
    private String poNumber;
    private String supplierId;
    private PurchaseOrderStatus status;
    private BigDecimal totalAmount;
    private String currency;
    private LocalDate createdDate;
    private String description;
}
