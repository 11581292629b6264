package com.apflow.invoice.canonical;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One field listed in a run report.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReportEntry {
    String field;
    String extractedValue;
    String reason;
    String suggestedCorrection;
}
