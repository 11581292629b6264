package com.apflow.invoice.canonical;

import com.apflow.invoice.canonical.enums.RoutingOutcome;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class RoutingDecision {
    RoutingOutcome outcome;
    double score;

    @Singular
    List<String> reasons;
}
