package com.apflow.invoice.tools.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response of the four validate_* tools.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CheckToolResponse {

    @NotNull
    private Status status;

    /**
     * Reference system's value for the field, when it can offer one.
     */
    private String canonicalValue;

    private String message;

    public enum Status {
        MATCH("MATCH"),
        MISMATCH("MISMATCH"),
        NOT_FOUND("NOT_FOUND");

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
