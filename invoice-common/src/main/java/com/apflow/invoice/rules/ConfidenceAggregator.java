package com.apflow.invoice.rules;

import com.apflow.invoice.canonical.AggregatedConfidence;
import com.apflow.invoice.canonical.ExtractedField;
import com.apflow.invoice.canonical.ExtractedInvoice;
import com.apflow.invoice.canonical.FieldAssessment;
import com.apflow.invoice.canonical.VerificationOutcome;
import com.apflow.invoice.canonical.enums.CheckKind;
import com.apflow.invoice.canonical.enums.VerificationResult;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Combines verification outcomes and extraction confidences into one
 * aggregated confidence.
 *
 * Pure: the result depends only on the invoice, the outcomes and the policy.
 * Checks are always visited in {@link CheckKind} declaration order, so the
 * order in which outcomes arrived never affects the score.
 */
public class ConfidenceAggregator {

    static final String NOT_VERIFIED = "not verified";

    private final ValidationPolicy policy;

    public ConfidenceAggregator(ValidationPolicy policy) {
        this.policy = policy;
    }

    /**
     * @throws IllegalArgumentException if more than one outcome is given for the same check kind
     */
    public AggregatedConfidence aggregate(ExtractedInvoice invoice, Collection<VerificationOutcome> outcomes) {
        Map<CheckKind, VerificationOutcome> byKind = new EnumMap<>(CheckKind.class);
        for (VerificationOutcome outcome : outcomes) {
            if (byKind.put(outcome.getCheckKind(), outcome) != null) {
                throw new IllegalArgumentException("Duplicate outcome for check " + outcome.getCheckKind());
            }
        }

        AggregatedConfidence.AggregatedConfidenceBuilder builder = AggregatedConfidence.builder();
        Map<CheckKind, FieldAssessment> assessments = new LinkedHashMap<>();
        double sum = 0.0;
        int resolved = 0;
        int toolErrors = 0;

        for (CheckKind kind : CheckKind.values()) {
            FieldAssessment assessment = assess(invoice, kind, byKind.get(kind));
            assessments.put(kind, assessment);

            if (assessment.isUnresolved()) {
                toolErrors++;
                builder.unresolvedField(kind.getFieldName());
                builder.failureReason(kind.getFieldName() + ": " + assessment.getReason());
                continue;
            }
            sum += assessment.getConfidence();
            resolved++;
            if (!assessment.isPassed()) {
                builder.failureReason(kind.getFieldName() + ": " + assessment.getReason());
            }
        }

        return builder
            .overallScore(resolved == 0 ? 0.0 : sum / resolved)
            .assessments(Collections.unmodifiableMap(assessments))
            .reviewForced(toolErrors > policy.getMaxToolErrorsBeforeReview())
            .build();
    }

    private FieldAssessment assess(ExtractedInvoice invoice, CheckKind kind, VerificationOutcome outcome) {
        FieldAssessment.FieldAssessmentBuilder assessment = FieldAssessment.builder()
            .checkKind(kind)
            .fieldName(kind.getFieldName());

        if (outcome == null) {
            return assessment
                .result(VerificationResult.NOT_FOUND)
                .confidence(0.0)
                .passed(false)
                .reason(NOT_VERIFIED)
                .build();
        }

        assessment.result(outcome.getResult());
        switch (outcome.getResult()) {
            case MATCH: {
                double confidence = extractionConfidence(invoice, kind);
                boolean passed = confidence >= policy.getFieldPassThreshold();
                return assessment
                    .confidence(confidence)
                    .passed(passed)
                    .reason(passed ? "verified" : "verified but extraction confidence " + confidence
                        + " below " + policy.getFieldPassThreshold())
                    .build();
            }
            case MISMATCH:
                return assessment
                    .confidence(0.0)
                    .passed(false)
                    .suggestedCorrection(outcome.getCanonicalValue())
                    .reason(describe("does not match reference data", outcome))
                    .build();
            case NOT_FOUND:
                return assessment
                    .confidence(0.0)
                    .passed(false)
                    .suggestedCorrection(outcome.getCanonicalValue())
                    .reason(describe("not found in reference data", outcome))
                    .build();
            case TOOL_ERROR:
            default:
                return assessment
                    .unresolved(true)
                    .passed(false)
                    .reason("unresolved: check failed with " + outcome.getToolErrorType()
                        + " after " + outcome.getAttempts() + " attempt(s)")
                    .build();
        }
    }

    private static double extractionConfidence(ExtractedInvoice invoice, CheckKind kind) {
        switch (kind) {
            case TAX_ID:
                return confidenceOf(invoice.getTaxId());
            case NATIONAL_ID:
                return confidenceOf(invoice.getNationalId());
            case BANK_ACCOUNT:
                return Math.min(confidenceOf(invoice.getBankAccountNumber()),
                    confidenceOf(invoice.getBankRoutingCode()));
            case PURCHASE_ORDER:
                return confidenceOf(invoice.getPurchaseOrderRef());
            default:
                throw new IllegalArgumentException("Unknown check kind: " + kind);
        }
    }

    private static double confidenceOf(ExtractedField<?> field) {
        return field.confidenceOrZero();
    }

    private static String describe(String base, VerificationOutcome outcome) {
        return outcome.getMessage() == null ? base : base + " (" + outcome.getMessage() + ")";
    }
}
