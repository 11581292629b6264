package com.apflow.invoice.canonical;

import com.apflow.invoice.canonical.enums.PipelineState;
import com.apflow.invoice.canonical.enums.RoutingOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of a pipeline run, as returned by the API and published
 * on the final status topic.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineRunRecord {
    String runId;
    int attempt;
    PipelineState state;
    String invoiceNumber;
    String supplierName;
    List<VerificationOutcome> outcomes;
    AggregatedConfidence confidence;
    RoutingDecision decision;

    /**
     * Final outcome after finalization; differs from the decision when the
     * system of record rejected a PROCEED.
     */
    RoutingOutcome finalOutcome;

    String createdRecordId;
    RunReport report;
    List<StateTransition> transitions;
    Instant createdAt;
    Instant updatedAt;
}
