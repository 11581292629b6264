package com.apflow.invoice.orchestrator.state;

import com.apflow.invoice.canonical.AggregatedConfidence;
import com.apflow.invoice.canonical.ExtractedInvoice;
import com.apflow.invoice.canonical.PipelineRunRecord;
import com.apflow.invoice.canonical.RoutingDecision;
import com.apflow.invoice.canonical.RunReport;
import com.apflow.invoice.canonical.StateTransition;
import com.apflow.invoice.canonical.VerificationOutcome;
import com.apflow.invoice.canonical.enums.PipelineState;
import com.apflow.invoice.canonical.enums.RoutingOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One attempt at taking an extracted invoice through the pipeline.
 *
 * Owned by a single worker thread while it runs; readers (API, cancellation)
 * only see it through the synchronized accessors. State changes go through
 * {@link #transitionTo}, which refuses moves the state table does not allow.
 */
public class PipelineRun {

    private static final Logger log = LoggerFactory.getLogger(PipelineRun.class);
    private static final String IDEMPOTENCY_KEY_PREFIX = "invoice-run:";

    private final String runId;
    private final int attempt;
    private final ExtractedInvoice invoice;
    private final Clock clock;
    private final Instant createdAt;
    private final CompletableFuture<PipelineRun> completion = new CompletableFuture<>();

    private PipelineState state = PipelineState.RECEIVED;
    private Instant updatedAt;
    private boolean cancelRequested;
    private final List<StateTransition> transitions = new ArrayList<>();

    private List<VerificationOutcome> outcomes = Collections.emptyList();
    private List<String> ruleViolations = Collections.emptyList();
    private AggregatedConfidence confidence;
    private RoutingDecision decision;
    private RoutingOutcome finalOutcome;
    private String createdRecordId;
    private RunReport report;

    public PipelineRun(String runId, int attempt, ExtractedInvoice invoice, Clock clock) {
        this.runId = runId;
        this.attempt = attempt;
        this.invoice = invoice;
        this.clock = clock;
        this.createdAt = Instant.now(clock);
        this.updatedAt = createdAt;
    }

    /**
     * Move to the target state.
     *
     * @throws IllegalStateException if the current state does not allow the move
     */
    public synchronized void transitionTo(PipelineState target, String reason) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + target + " for run " + runId);
        }
        Instant now = Instant.now(clock);
        transitions.add(StateTransition.builder().from(state).to(target).at(now).reason(reason).build());
        log.info("Run transition - runId={}, attempt={}, stage={}, from={}, reason={}",
            runId, attempt, target, state, reason);
        state = target;
        updatedAt = now;
    }

    /**
     * Ask the run to stop at its next stage boundary.
     *
     * @return false once finalization has begun or the run is terminal
     */
    public synchronized boolean requestCancel() {
        if (state.isTerminal() || state == PipelineState.FINALIZING) {
            return false;
        }
        cancelRequested = true;
        return true;
    }

    /**
     * Enter FINALIZING unless a cancellation was requested first.
     */
    public synchronized boolean beginFinalizing() {
        if (cancelRequested) {
            return false;
        }
        transitionTo(PipelineState.FINALIZING, "finalizing " + (decision == null ? "run" : decision.getOutcome()));
        return true;
    }

    public synchronized boolean isCancelRequested() {
        return cancelRequested;
    }

    /**
     * Idempotency key for record creation; stable across attempts of the same run.
     */
    public String idempotencyKey() {
        return IDEMPOTENCY_KEY_PREFIX + runId;
    }

    public synchronized PipelineRunRecord toRecord() {
        return PipelineRunRecord.builder()
            .runId(runId)
            .attempt(attempt)
            .state(state)
            .invoiceNumber(invoice.invoiceNumberValue())
            .supplierName(invoice.supplierNameValue())
            .outcomes(outcomes)
            .confidence(confidence)
            .decision(decision)
            .finalOutcome(finalOutcome)
            .createdRecordId(createdRecordId)
            .report(report)
            .transitions(Collections.unmodifiableList(new ArrayList<>(transitions)))
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    public CompletableFuture<PipelineRun> completion() {
        return completion;
    }

    public String getRunId() {
        return runId;
    }

    public int getAttempt() {
        return attempt;
    }

    public ExtractedInvoice getInvoice() {
        return invoice;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized PipelineState getState() {
        return state;
    }

    public synchronized List<StateTransition> getTransitions() {
        return Collections.unmodifiableList(new ArrayList<>(transitions));
    }

    public synchronized List<VerificationOutcome> getOutcomes() {
        return outcomes;
    }

    public synchronized void setOutcomes(List<VerificationOutcome> outcomes) {
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    }

    public synchronized List<String> getRuleViolations() {
        return ruleViolations;
    }

    public synchronized void setRuleViolations(List<String> ruleViolations) {
        this.ruleViolations = Collections.unmodifiableList(new ArrayList<>(ruleViolations));
    }

    public synchronized AggregatedConfidence getConfidence() {
        return confidence;
    }

    public synchronized void setConfidence(AggregatedConfidence confidence) {
        this.confidence = confidence;
    }

    public synchronized RoutingDecision getDecision() {
        return decision;
    }

    public synchronized void setDecision(RoutingDecision decision) {
        this.decision = decision;
    }

    public synchronized RoutingOutcome getFinalOutcome() {
        return finalOutcome;
    }

    public synchronized void setFinalOutcome(RoutingOutcome finalOutcome) {
        this.finalOutcome = finalOutcome;
    }

    public synchronized String getCreatedRecordId() {
        return createdRecordId;
    }

    public synchronized void setCreatedRecordId(String createdRecordId) {
        this.createdRecordId = createdRecordId;
    }

    public synchronized RunReport getReport() {
        return report;
    }

    public synchronized void setReport(RunReport report) {
        this.report = report;
    }
}
