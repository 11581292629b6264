package com.apflow.invoice.canonical;

import com.apflow.invoice.canonical.enums.PipelineState;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One recorded move of a pipeline run between states.
 */
@Value
@Builder
@Jacksonized
public class StateTransition {
    PipelineState from;
    PipelineState to;
    Instant at;
    String reason;
}
