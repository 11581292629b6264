package com.apflow.invoice.rules;

import com.apflow.invoice.canonical.AggregatedConfidence;
import com.apflow.invoice.canonical.RoutingDecision;
import com.apflow.invoice.canonical.enums.RoutingOutcome;

import java.util.List;

/**
 * Maps an aggregated confidence (plus business-rule violations) to a routing
 * decision.
 *
 * Review is forced once the aggregator counts more TOOL_ERROR outcomes than
 * the policy tolerates. Below that count, PROCEED needs a score above the
 * proceed threshold over the resolved fields, every resolved field passing and
 * no rule violation; tolerated unresolved fields are listed as reasons. REJECT
 * needs a score at or below the threshold, at least one definitive failure and
 * nothing unresolved, so an unresolved check together with a mismatch still
 * goes to MANUAL_REVIEW.
 */
public class RoutingDecisionEngine {

    private final ValidationPolicy policy;

    public RoutingDecisionEngine(ValidationPolicy policy) {
        this.policy = policy;
    }

    public RoutingDecision decide(AggregatedConfidence confidence, List<String> ruleViolations) {
        double score = confidence.getOverallScore();
        RoutingDecision.RoutingDecisionBuilder decision = RoutingDecision.builder().score(score);

        if (confidence.isReviewForced()) {
            decision.reason("unresolved fields: " + String.join(", ", confidence.getUnresolvedFields()));
            confidence.getFailureReasons().forEach(decision::reason);
            ruleViolations.forEach(decision::reason);
            return decision.outcome(RoutingOutcome.MANUAL_REVIEW).build();
        }

        boolean aboveThreshold = score > policy.getProceedThreshold();
        if (aboveThreshold && confidence.allCheckedFieldsPass() && ruleViolations.isEmpty()) {
            decision
                .outcome(RoutingOutcome.PROCEED)
                .reason("score " + score + " above " + policy.getProceedThreshold() + " and all checks passed");
            if (confidence.hasUnresolvedFields()) {
                decision.reason("tolerated unresolved fields: "
                    + String.join(", ", confidence.getUnresolvedFields()));
            }
            return decision.build();
        }

        confidence.getFailureReasons().forEach(decision::reason);
        ruleViolations.forEach(decision::reason);

        if (!aboveThreshold && confidence.hasDefinitiveFailure() && !confidence.hasUnresolvedFields()) {
            return decision
                .outcome(RoutingOutcome.REJECT)
                .reason("score " + score + " at or below " + policy.getProceedThreshold())
                .build();
        }
        return decision.outcome(RoutingOutcome.MANUAL_REVIEW).build();
    }
}
