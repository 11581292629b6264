package com.apflow.invoice.canonical;

import com.apflow.invoice.canonical.enums.RunReportType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Structured report attached to every terminal pipeline run.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunReport {
    RunReportType type;
    String runId;
    String invoiceNumber;
    String supplierName;
    Double overallScore;

    @Singular
    List<ReportEntry> entries;

    @Singular
    List<String> unresolvedFields;

    @Singular
    List<String> ruleViolations;

    String recommendation;
    String createdRecordId;
    Instant generatedAt;
}
