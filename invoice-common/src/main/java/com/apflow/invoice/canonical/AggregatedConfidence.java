package com.apflow.invoice.canonical;

import com.apflow.invoice.canonical.enums.CheckKind;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Combined confidence for an invoice across all checks.
 */
@Value
@Builder
@Jacksonized
public class AggregatedConfidence {

    /**
     * Arithmetic mean of resolved field confidences, in [0, 1].
     */
    double overallScore;

    /**
     * One assessment per check kind, in check declaration order.
     */
    Map<CheckKind, FieldAssessment> assessments;

    @Singular
    List<String> failureReasons;

    /**
     * Field names whose check ended in TOOL_ERROR.
     */
    @Singular
    List<String> unresolvedFields;

    boolean reviewForced;

    @JsonIgnore
    public boolean hasDefinitiveFailure() {
        return assessments.values().stream()
            .anyMatch(a -> a.getResult() != null && a.getResult().isDefinitiveFailure());
    }

    @JsonIgnore
    public boolean allCheckedFieldsPass() {
        return assessments.values().stream()
            .filter(a -> !a.isUnresolved())
            .allMatch(FieldAssessment::isPassed);
    }

    @JsonIgnore
    public boolean hasUnresolvedFields() {
        return !unresolvedFields.isEmpty();
    }
}
