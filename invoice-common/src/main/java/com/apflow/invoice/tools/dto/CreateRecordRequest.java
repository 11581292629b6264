package com.apflow.invoice.tools.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateRecordRequest {
    @NotBlank
    private String idempotencyKey;

    @Valid
    @NotNull
    private InvoiceRecordPayload invoice;
}
