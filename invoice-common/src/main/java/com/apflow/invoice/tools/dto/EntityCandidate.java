package com.apflow.invoice.tools.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Registered supplier returned by a name lookup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EntityCandidate {
    @NotBlank
    private String supplierId;

    @NotBlank
    private String name;

    private String taxId;
    private String nationalId;
    private String accountNumber;
    private String routingCode;
}
