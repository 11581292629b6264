package com.apflow.invoice.orchestrator;

import com.apflow.invoice.canonical.AggregatedConfidence;
import com.apflow.invoice.canonical.ExtractedField;
import com.apflow.invoice.canonical.ExtractedInvoice;
import com.apflow.invoice.canonical.RoutingDecision;
import com.apflow.invoice.canonical.VerificationOutcome;
import com.apflow.invoice.canonical.enums.CheckKind;
import com.apflow.invoice.canonical.enums.PipelineState;
import com.apflow.invoice.canonical.enums.RoutingOutcome;
import com.apflow.invoice.canonical.enums.VerificationResult;
import com.apflow.invoice.orchestrator.notification.NotificationDispatcher;
import com.apflow.invoice.orchestrator.report.ReportFactory;
import com.apflow.invoice.orchestrator.state.PipelineRun;
import com.apflow.invoice.orchestrator.validation.ExtractionMalformedException;
import com.apflow.invoice.orchestrator.validation.InvoiceIntakeValidator;
import com.apflow.invoice.orchestrator.validation.VerificationFanOut;
import com.apflow.invoice.rules.ConfidenceAggregator;
import com.apflow.invoice.rules.InvoiceBusinessRules;
import com.apflow.invoice.rules.RoutingDecisionEngine;
import com.apflow.invoice.tools.ReferenceToolClient;
import com.apflow.invoice.tools.ToolException;
import com.apflow.invoice.tools.dto.InvoiceRecordPayload;
import com.apflow.invoice.tools.dto.RecordCreationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Invoice Pipeline Orchestrator Service.
 *
 * Takes an extracted invoice through the pipeline as an explicit state machine:
 * 1. RECEIVED: intake validation (malformed extraction fails the run, no tool calls)
 * 2. VALIDATING: concurrent reference checks with retry and per-check deadline
 * 3. AGGREGATING: confidence aggregation and business rules
 * 4. ROUTED: routing decision
 * 5. FINALIZING: record creation (PROCEED) or report (REJECT / MANUAL_REVIEW)
 * 6. COMPLETED / FAILED / CANCELLED: notification, archive, final status
 *
 * Each run executes on one worker thread. Cancellation is cooperative and
 * checked at every stage boundary up to FINALIZING.
 *
 * Re-submitting an invoice with the same submission id returns a COMPLETED run
 * unchanged, is refused while a run is active, and starts a new attempt (same
 * run id, same idempotency key) after FAILED or CANCELLED.
 */
@Service
public class PipelineOrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestratorService.class);

    private final ReferenceToolClient toolClient;
    private final InvoiceIntakeValidator intakeValidator;
    private final VerificationFanOut verificationFanOut;
    private final ConfidenceAggregator confidenceAggregator;
    private final InvoiceBusinessRules businessRules;
    private final RoutingDecisionEngine decisionEngine;
    private final ReportFactory reportFactory;
    private final PipelineRunRepository repository;
    private final NotificationDispatcher notificationDispatcher;
    private final RunOutcomePublisher outcomePublisher;
    private final ExecutorService runExecutor;
    private final Clock clock;

    public PipelineOrchestratorService(ReferenceToolClient toolClient,
                                       InvoiceIntakeValidator intakeValidator,
                                       VerificationFanOut verificationFanOut,
                                       ConfidenceAggregator confidenceAggregator,
                                       InvoiceBusinessRules businessRules,
                                       RoutingDecisionEngine decisionEngine,
                                       ReportFactory reportFactory,
                                       PipelineRunRepository repository,
                                       NotificationDispatcher notificationDispatcher,
                                       RunOutcomePublisher outcomePublisher,
                                       @Qualifier("pipelineRunExecutor") ExecutorService runExecutor,
                                       Clock clock) {
        this.toolClient = toolClient;
        this.intakeValidator = intakeValidator;
        this.verificationFanOut = verificationFanOut;
        this.confidenceAggregator = confidenceAggregator;
        this.businessRules = businessRules;
        this.decisionEngine = decisionEngine;
        this.reportFactory = reportFactory;
        this.repository = repository;
        this.notificationDispatcher = notificationDispatcher;
        this.outcomePublisher = outcomePublisher;
        this.runExecutor = runExecutor;
        this.clock = clock;
    }

    /**
     * Admit the invoice and schedule it on the run worker pool.
     *
     * @return the admitted run; its {@link PipelineRun#completion()} completes when the run terminates
     */
    public PipelineRun enqueue(ExtractedInvoice invoice) {
        PipelineRun run = admit(invoice);
        if (run.getState() == PipelineState.COMPLETED) {
            return run;
        }
        runExecutor.execute(() -> execute(run));
        return run;
    }

    public CompletableFuture<PipelineRun> submit(ExtractedInvoice invoice) {
        return enqueue(invoice).completion();
    }

    /**
     * Run the pipeline on the calling thread.
     */
    public PipelineRun process(ExtractedInvoice invoice) {
        PipelineRun run = admit(invoice);
        if (run.getState() != PipelineState.COMPLETED) {
            execute(run);
        }
        return run;
    }

    /**
     * Request cancellation of the latest attempt of a run.
     *
     * @return false if the run is unknown, already finalizing or terminal
     */
    public boolean cancel(String runId) {
        Optional<PipelineRun> run = repository.find(runId);
        if (run.isEmpty()) {
            return false;
        }
        boolean accepted = run.get().requestCancel();
        log.info("Cancellation requested - runId={}, state={}, accepted={}", runId, run.get().getState(), accepted);
        return accepted;
    }

    public Optional<PipelineRun> findRun(String runId) {
        return repository.find(runId);
    }

    public List<PipelineRun> listRuns() {
        return repository.findAll();
    }

    private PipelineRun admit(ExtractedInvoice invoice) {
        if (invoice == null) {
            throw new IllegalArgumentException("Invoice must not be null");
        }
        String runId = invoice.getSubmissionId() == null || invoice.getSubmissionId().isBlank()
            ? UUID.randomUUID().toString()
            : invoice.getSubmissionId();
        PipelineRun run = repository.admit(runId, attempt -> new PipelineRun(runId, attempt, invoice, clock));
        if (run.getState() == PipelineState.COMPLETED) {
            run.completion().complete(run);
        }
        return run;
    }

    private void execute(PipelineRun run) {
        String runId = run.getRunId();
        ExtractedInvoice invoice = run.getInvoice();
        try {
            checkpoint(run);
            try {
                intakeValidator.validate(invoice);
            } catch (ExtractionMalformedException e) {
                log.warn("Malformed extraction - runId={}, stage=RECEIVED, reason={}", runId, e.getMessage());
                run.setReport(reportFactory.failure(run, "malformed extraction: " + e.getMessage(), false));
                run.transitionTo(PipelineState.FAILED, "malformed extraction");
                terminate(run);
                return;
            }

            run.transitionTo(PipelineState.VALIDATING, "intake validation passed");
            List<VerificationOutcome> outcomes = verificationFanOut.verify(runId, invoice);
            run.setOutcomes(outcomes);
            checkpoint(run);

            run.transitionTo(PipelineState.AGGREGATING, outcomes.size() + " checks settled");
            AggregatedConfidence confidence = confidenceAggregator.aggregate(invoice, outcomes);
            List<String> violations = businessRules.check(invoice);
            run.setConfidence(confidence);
            run.setRuleViolations(violations);
            log.info("Confidence aggregated - runId={}, stage=AGGREGATING, score={}, unresolved={}, violations={}",
                runId, confidence.getOverallScore(), confidence.getUnresolvedFields(), violations.size());
            checkpoint(run);

            RoutingDecision decision = decisionEngine.decide(confidence, violations);
            run.setDecision(decision);
            run.transitionTo(PipelineState.ROUTED, "decision " + decision.getOutcome());

            if (!run.beginFinalizing()) {
                throw new RunCancelledException();
            }
            finalizeRun(run, decision);

        } catch (RunCancelledException e) {
            run.setReport(reportFactory.cancelled(run));
            run.transitionTo(PipelineState.CANCELLED, "cancellation requested");
            terminate(run);
        } catch (RuntimeException e) {
            log.error("Run failed - runId={}, state={}", runId, run.getState(), e);
            if (!run.getState().isTerminal()) {
                run.setReport(reportFactory.failure(run, "unexpected error: " + e.getMessage(), false));
                run.transitionTo(PipelineState.FAILED, "unexpected error");
            }
            terminate(run);
        }
    }

    private void finalizeRun(PipelineRun run, RoutingDecision decision) {
        switch (decision.getOutcome()) {
            case PROCEED:
                createRecord(run);
                break;
            case REJECT:
                run.setFinalOutcome(RoutingOutcome.REJECT);
                run.setReport(reportFactory.rejection(run));
                run.transitionTo(PipelineState.COMPLETED, "rejected");
                break;
            case MANUAL_REVIEW:
            default:
                run.setFinalOutcome(RoutingOutcome.MANUAL_REVIEW);
                run.setReport(reportFactory.reviewRequired(run));
                run.transitionTo(PipelineState.COMPLETED, "manual review required");
                break;
        }
        terminate(run);
    }

    /**
     * Create the invoice record exactly once for this attempt.
     */
    private void createRecord(PipelineRun run) {
        String key = run.idempotencyKey();
        RecordCreationResult result;
        try {
            result = toolClient.createRecord(buildPayload(run), key);
        } catch (ToolException e) {
            log.error("Record creation outcome unknown - runId={}, idempotencyKey={}, tool={}, errorType={}",
                run.getRunId(), key, e.getToolName(), e.getErrorType(), e);
            run.setReport(reportFactory.failure(run, "record creation outcome unknown ("
                + e.getErrorType().getValue() + "): " + e.getMessage(), true));
            run.transitionTo(PipelineState.FAILED, "record creation outcome unknown");
            return;
        }

        if (result.isSuccessful()) {
            run.setFinalOutcome(RoutingOutcome.PROCEED);
            run.setCreatedRecordId(result.getRecordId());
            run.setReport(reportFactory.accepted(run, result));
            log.info("Invoice recorded - runId={}, stage=FINALIZING, status={}, recordId={}",
                run.getRunId(), result.getStatus(), result.getRecordId());
            run.transitionTo(PipelineState.COMPLETED, "record " + result.getStatus().getValue());
        } else {
            run.setFinalOutcome(RoutingOutcome.REJECT);
            run.setReport(reportFactory.recordRejected(run, result));
            log.warn("Invoice rejected by system of record - runId={}, code={}, message={}",
                run.getRunId(), result.getRejectionCode(), result.getMessage());
            run.transitionTo(PipelineState.COMPLETED, "rejected by system of record");
        }
    }

    /**
     * Notify, archive, publish, in that order, then release waiters.
     */
    private void terminate(PipelineRun run) {
        notificationDispatcher.notifyOutcome(run);
        outcomePublisher.publish(repository.archive(run));
        log.info("Run terminated - runId={}, attempt={}, state={}, finalOutcome={}",
            run.getRunId(), run.getAttempt(), run.getState(), run.getFinalOutcome());
        run.completion().complete(run);
    }

    private static void checkpoint(PipelineRun run) {
        if (run.isCancelRequested()) {
            throw new RunCancelledException();
        }
    }

    private static InvoiceRecordPayload buildPayload(PipelineRun run) {
        ExtractedInvoice invoice = run.getInvoice();
        return InvoiceRecordPayload.builder()
            .invoiceNumber(invoice.invoiceNumberValue())
            .supplierName(invoice.supplierNameValue())
            .taxId(verifiedValue(run, CheckKind.TAX_ID, invoice.getTaxId()))
            .nationalId(verifiedValue(run, CheckKind.NATIONAL_ID, invoice.getNationalId()))
            .accountNumber(valueOrNull(invoice.getBankAccountNumber()))
            .routingCode(valueOrNull(invoice.getBankRoutingCode()))
            .purchaseOrderRef(verifiedValue(run, CheckKind.PURCHASE_ORDER, invoice.getPurchaseOrderRef()))
            .invoiceDate(valueOrNull(invoice.getInvoiceDate()))
            .currency(valueOrNull(invoice.getCurrency()))
            .netAmount(valueOrNull(invoice.getNetAmount()))
            .taxAmount(valueOrNull(invoice.getTaxAmount()))
            .totalAmount(valueOrNull(invoice.getTotalAmount()))
            .lineItems(invoice.getLineItems().isPresent() ? invoice.getLineItems().getValue() : null)
            .build();
    }

    /**
     * Reference system's canonical form of a matched field, else the extracted value.
     */
    private static String verifiedValue(PipelineRun run, CheckKind kind, ExtractedField<String> field) {
        for (VerificationOutcome outcome : run.getOutcomes()) {
            if (outcome.getCheckKind() == kind && outcome.getResult() == VerificationResult.MATCH
                    && outcome.getCanonicalValue() != null) {
                return outcome.getCanonicalValue();
            }
        }
        return valueOrNull(field);
    }

    private static <T> T valueOrNull(ExtractedField<T> field) {
        return field.isPresent() ? field.getValue() : null;
    }

    private static class RunCancelledException extends RuntimeException {
        RunCancelledException() {
            super("run cancelled", null, false, false);
        }
    }
}
