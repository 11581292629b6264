package com.apflow.invoice.tools.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response of create_invoice_record.
 *
 * CREATED and DUPLICATE carry the record id; REJECTED carries a reason code
 * and message from the system of record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecordCreationResult {

    @NotNull
    private Status status;

    private String recordId;
    private String rejectionCode;
    private String message;

    @JsonIgnore
    public boolean isSuccessful() {
        return status == Status.CREATED || status == Status.DUPLICATE;
    }

    public static RecordCreationResult created(String recordId) {
        return RecordCreationResult.builder().status(Status.CREATED).recordId(recordId).build();
    }

    public static RecordCreationResult duplicate(String recordId) {
        return RecordCreationResult.builder()
            .status(Status.DUPLICATE)
            .recordId(recordId)
            .message("idempotent replay of an already created record")
            .build();
    }

    public static RecordCreationResult rejected(String code, String message) {
        return RecordCreationResult.builder().status(Status.REJECTED).rejectionCode(code).message(message).build();
    }

    public enum Status {
        CREATED("CREATED"),
        DUPLICATE("DUPLICATE"),
        REJECTED("REJECTED");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
