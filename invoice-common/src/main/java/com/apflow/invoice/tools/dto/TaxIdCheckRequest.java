package com.apflow.invoice.tools.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaxIdCheckRequest {
    @NotBlank
    private String taxId;

    /**
     * Supplier name as printed on the invoice.
     */
    private String supplierName;
}
