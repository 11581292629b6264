package com.apflow.invoice.canonical;

import com.apflow.invoice.canonical.enums.CheckKind;
import com.apflow.invoice.canonical.enums.VerificationResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Aggregator's view of one checked field.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldAssessment {
    CheckKind checkKind;
    String fieldName;
    VerificationResult result;

    /**
     * Field confidence; null when the field is unresolved.
     */
    Double confidence;

    boolean unresolved;
    boolean passed;
    String suggestedCorrection;
    String reason;
}
