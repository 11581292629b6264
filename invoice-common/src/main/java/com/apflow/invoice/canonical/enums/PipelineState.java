package com.apflow.invoice.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * States of a pipeline run.
 *
 * RECEIVED -> VALIDATING -> AGGREGATING -> ROUTED -> FINALIZING -> COMPLETED.
 * FAILED is reachable from every non-terminal state. CANCELLED is reachable
 * from every state before FINALIZING.
 */
public enum PipelineState {
    RECEIVED("RECEIVED"),
    VALIDATING("VALIDATING"),
    AGGREGATING("AGGREGATING"),
    ROUTED("ROUTED"),
    FINALIZING("FINALIZING"),
    COMPLETED("COMPLETED"),
    FAILED("FAILED"),
    CANCELLED("CANCELLED");

    private final String value;

    PipelineState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * States this state may move to.
     */
    public Set<PipelineState> allowedTransitions() {
        switch (this) {
            case RECEIVED:
                return Collections.unmodifiableSet(EnumSet.of(VALIDATING, FAILED, CANCELLED));
            case VALIDATING:
                return Collections.unmodifiableSet(EnumSet.of(AGGREGATING, FAILED, CANCELLED));
            case AGGREGATING:
                return Collections.unmodifiableSet(EnumSet.of(ROUTED, FAILED, CANCELLED));
            case ROUTED:
                return Collections.unmodifiableSet(EnumSet.of(FINALIZING, FAILED, CANCELLED));
            case FINALIZING:
                return Collections.unmodifiableSet(EnumSet.of(COMPLETED, FAILED));
            default:
                return Collections.emptySet();
        }
    }

    public boolean canTransitionTo(PipelineState target) {
        return allowedTransitions().contains(target);
    }
}
