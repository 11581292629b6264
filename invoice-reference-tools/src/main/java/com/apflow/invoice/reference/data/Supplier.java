package com.apflow.invoice.reference.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Supplier master data record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Supplier {
    private String supplierId;
    private String name;

    /**
     * Intra-community VAT number.
     */
    private String taxId;

    /**
     * SIRET (14 digits).
     */
    private String nationalId;

    /**
     * IBAN.
     */
    private String accountNumber;

    /**
     * BIC.
     */
    private String routingCode;

    private String address;
    private String city;
    private String country;

    @Builder.Default
    private boolean active = true;
}
