package com.apflow.invoice.orchestrator;

import com.apflow.invoice.canonical.ExtractedField;
import com.apflow.invoice.canonical.ExtractedInvoice;
import com.apflow.invoice.canonical.enums.PipelineState;
import com.apflow.invoice.canonical.enums.RoutingOutcome;
import com.apflow.invoice.canonical.enums.RunReportType;
import com.apflow.invoice.orchestrator.client.JsonToolClient;
import com.apflow.invoice.orchestrator.notification.NotificationDispatcher;
import com.apflow.invoice.orchestrator.report.ReportFactory;
import com.apflow.invoice.orchestrator.state.PipelineRun;
import com.apflow.invoice.orchestrator.validation.CheckRetryPolicy;
import com.apflow.invoice.orchestrator.validation.InvoiceIntakeValidator;
import com.apflow.invoice.orchestrator.validation.VerificationFanOut;
import com.apflow.invoice.rules.ConfidenceAggregator;
import com.apflow.invoice.rules.InvoiceBusinessRules;
import com.apflow.invoice.rules.RoutingDecisionEngine;
import com.apflow.invoice.rules.ValidationPolicy;
import com.apflow.invoice.tools.ToolNames;
import com.apflow.invoice.tools.ToolTimeoutException;
import com.apflow.invoice.tools.ToolUnavailableException;
import jakarta.validation.Validation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end pipeline runs against the reference tools served in-process.
 */
public class PipelineOrchestratorServiceTest {

    private InProcessTools tools;
    private NotificationDispatcher notifications;
    private PipelineRunRepository repository;
    private ExecutorService verificationExecutor;
    private ExecutorService runExecutor;
    private PipelineOrchestratorService service;

    @BeforeEach
    public void setUp() {
        Clock clock = Clock.systemUTC();
        ValidationPolicy policy = ValidationPolicy.defaults();
        tools = new InProcessTools();
        notifications = new NotificationDispatcher(null, clock);
        repository = new PipelineRunRepository();
        verificationExecutor = Executors.newFixedThreadPool(4);
        runExecutor = Executors.newFixedThreadPool(2);

        JsonToolClient client = new JsonToolClient(tools, clock);
        service = new PipelineOrchestratorService(
            client,
            new InvoiceIntakeValidator(Validation.buildDefaultValidatorFactory().getValidator()),
            new VerificationFanOut(client, new CheckRetryPolicy(2, 10, 2.0), verificationExecutor, clock, 5000),
            new ConfidenceAggregator(policy),
            new InvoiceBusinessRules(policy),
            new RoutingDecisionEngine(policy),
            new ReportFactory(clock),
            repository,
            notifications,
            RunOutcomePublisher.mock(),
            runExecutor,
            clock);
    }

    @AfterEach
    public void tearDown() {
        runExecutor.shutdownNow();
        verificationExecutor.shutdownNow();
    }

    /**
     * Every check matches: the invoice is posted once and the run completes.
     */
    @Test
    public void testCleanInvoiceProceeds() {
        PipelineRun run = service.process(TestInvoices.technoVision("sub-clean", "FV-2025-0042"));

        assertEquals(PipelineState.COMPLETED, run.getState());
        assertEquals(RoutingOutcome.PROCEED, run.getDecision().getOutcome());
        assertEquals(RoutingOutcome.PROCEED, run.getFinalOutcome());
        assertTrue(run.getCreatedRecordId().startsWith("ERP-INV-"));
        assertEquals(RunReportType.ACCEPTED, run.getReport().getType());
        assertEquals(0.95, run.getConfidence().getOverallScore(), 1e-9);
        assertEquals(1, tools.calls(ToolNames.CREATE_INVOICE_RECORD));
        assertEquals(1, tools.getLedger().getRecordCount());
        assertTrue(notifications.getHistory().isEmpty());
        assertEquals(1, repository.getArchivedRecords("sub-clean").size());
    }

    @Test
    public void testStateHistoryFollowsPipelineOrder() {
        PipelineRun run = service.process(TestInvoices.technoVision("sub-order", "FV-2025-0043"));

        assertEquals(PipelineState.VALIDATING, run.getTransitions().get(0).getTo());
        assertEquals(PipelineState.AGGREGATING, run.getTransitions().get(1).getTo());
        assertEquals(PipelineState.ROUTED, run.getTransitions().get(2).getTo());
        assertEquals(PipelineState.FINALIZING, run.getTransitions().get(3).getTo());
        assertEquals(PipelineState.COMPLETED, run.getTransitions().get(4).getTo());
    }

    /**
     * Wrong VAT number for a known supplier: rejected, one notification, nothing posted.
     */
    @Test
    public void testMismatchedTaxIdRejects() {
        ExtractedInvoice invoice = TestInvoices.technoVision("sub-reject", "FV-2025-0044").toBuilder()
            .taxId(ExtractedField.of("FR00000000000", 0.95))
            .build();

        PipelineRun run = service.process(invoice);

        assertEquals(PipelineState.COMPLETED, run.getState());
        assertEquals(RoutingOutcome.REJECT, run.getFinalOutcome());
        assertEquals(RunReportType.REJECTION, run.getReport().getType());
        assertEquals("taxId", run.getReport().getEntries().get(0).getField());
        assertEquals("FR82123456789", run.getReport().getEntries().get(0).getSuggestedCorrection());
        assertEquals(0, tools.calls(ToolNames.CREATE_INVOICE_RECORD));
        assertEquals(1, notifications.getHistory("sub-reject").size());
    }

    /**
     * Bank tool down: the check is retried, then left unresolved, and the run goes to review.
     */
    @Test
    public void testUnavailableToolRoutesToReview() {
        tools.override(ToolNames.VALIDATE_SUPPLIER_BANK, (tool, json) -> {
            throw new ToolUnavailableException(tool, "connection refused");
        });

        PipelineRun run = service.process(TestInvoices.technoVision("sub-review", "FV-2025-0045"));

        assertEquals(PipelineState.COMPLETED, run.getState());
        assertEquals(RoutingOutcome.MANUAL_REVIEW, run.getFinalOutcome());
        assertEquals(3, tools.calls(ToolNames.VALIDATE_SUPPLIER_BANK));
        assertTrue(run.getReport().getUnresolvedFields().contains("bankAccountNumber"));
        assertTrue(run.getDecision().getReasons().get(0).contains("bankAccountNumber"));
        assertEquals(0, tools.calls(ToolNames.CREATE_INVOICE_RECORD));
        assertEquals(1, notifications.getHistory("sub-review").size());
    }

    /**
     * No invoice number: the run fails before any tool is called.
     */
    @Test
    public void testMalformedExtractionFailsWithoutToolCalls() {
        ExtractedInvoice invoice = TestInvoices.technoVision("sub-malformed", "unused").toBuilder()
            .invoiceNumber(null)
            .build();

        PipelineRun run = service.process(invoice);

        assertEquals(PipelineState.FAILED, run.getState());
        assertEquals(RunReportType.FAILURE, run.getReport().getType());
        assertNull(run.getFinalOutcome());
        assertEquals(0, tools.totalCalls());
        assertTrue(notifications.getHistory().isEmpty());
    }

    /**
     * The record is created but the response is lost. Resubmitting the same
     * submission reuses the idempotency key and gets the same record back.
     */
    @Test
    public void testLostCreateResponseIsRecoveredByResubmission() {
        AtomicBoolean dropResponse = new AtomicBoolean(true);
        tools.override(ToolNames.CREATE_INVOICE_RECORD, (tool, json) -> {
            String response = tools.forward(tool, json);
            if (dropResponse.getAndSet(false)) {
                throw new ToolTimeoutException(tool, "read timed out");
            }
            return response;
        });
        ExtractedInvoice invoice = TestInvoices.technoVision("sub-lost", "FV-2025-0046");

        PipelineRun first = service.process(invoice);
        assertEquals(PipelineState.FAILED, first.getState());
        assertEquals(RunReportType.FAILURE, first.getReport().getType());
        assertTrue(first.getReport().getEntries().get(0).getReason().startsWith("record creation outcome unknown"));
        assertEquals(1, tools.getLedger().getRecordCount());

        PipelineRun second = service.process(invoice);

        assertEquals(2, second.getAttempt());
        assertEquals(first.idempotencyKey(), second.idempotencyKey());
        assertEquals(PipelineState.COMPLETED, second.getState());
        assertEquals(RoutingOutcome.PROCEED, second.getFinalOutcome());
        assertEquals(tools.getLedger().getAllRecords().get(0).getRecordId(), second.getCreatedRecordId());
        assertEquals(1, tools.getLedger().getRecordCount());
        assertEquals(2, repository.getArchivedRecords("sub-lost").size());
    }

    /**
     * Same invoice number posted twice under different submissions: the system
     * of record refuses the second one and the run ends as a rejection.
     */
    @Test
    public void testSystemOfRecordRejectionOverridesProceed() {
        service.process(TestInvoices.technoVision("sub-first", "FV-2025-0047"));

        PipelineRun run = service.process(TestInvoices.technoVision("sub-second", "FV-2025-0047"));

        assertEquals(RoutingOutcome.PROCEED, run.getDecision().getOutcome());
        assertEquals(RoutingOutcome.REJECT, run.getFinalOutcome());
        assertEquals(PipelineState.COMPLETED, run.getState());
        assertNull(run.getCreatedRecordId());
        assertTrue(run.getReport().getEntries().get(0).getReason().contains("DUPLICATE_INVOICE"));
        assertEquals(1, notifications.getHistory("sub-second").size());
    }

    @Test
    public void testCompletedSubmissionIsNotReprocessed() {
        PipelineRun first = service.process(TestInvoices.technoVision("sub-done", "FV-2025-0048"));
        int callsAfterFirst = tools.totalCalls();

        PipelineRun again = service.enqueue(TestInvoices.technoVision("sub-done", "FV-2025-0048"));

        assertSame(first, again);
        assertTrue(again.completion().isDone());
        assertEquals(callsAfterFirst, tools.totalCalls());
    }

    /**
     * Cancel while checks are in flight: the run stops at the next stage
     * boundary and nothing is posted.
     */
    @Test
    public void testCancelDuringValidation() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        tools.override(ToolNames.VALIDATE_TAX_ID, (tool, json) -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return tools.forward(tool, json);
        });

        PipelineRun run = service.enqueue(TestInvoices.technoVision("sub-cancel", "FV-2025-0049"));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertThrows(IllegalStateException.class,
            () -> service.enqueue(TestInvoices.technoVision("sub-cancel", "FV-2025-0049")));
        assertTrue(service.cancel("sub-cancel"));
        release.countDown();

        PipelineRun finished = run.completion().get(10, TimeUnit.SECONDS);
        assertEquals(PipelineState.CANCELLED, finished.getState());
        assertEquals(RunReportType.CANCELLED, finished.getReport().getType());
        assertEquals(0, tools.calls(ToolNames.CREATE_INVOICE_RECORD));
        assertFalse(service.cancel("sub-cancel"));
    }

    @Test
    public void testCancelledRunCanBeResubmitted() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        tools.override(ToolNames.VALIDATE_NATIONAL_ID, (tool, json) -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return tools.forward(tool, json);
        });
        ExtractedInvoice invoice = TestInvoices.technoVision("sub-retry", "FV-2025-0050");

        PipelineRun cancelled = service.enqueue(invoice);
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        service.cancel("sub-retry");
        release.countDown();
        cancelled.completion().get(10, TimeUnit.SECONDS);

        tools.clearOverride(ToolNames.VALIDATE_NATIONAL_ID);
        PipelineRun resubmitted = service.submit(invoice).get(10, TimeUnit.SECONDS);

        assertEquals(2, resubmitted.getAttempt());
        assertEquals(PipelineState.COMPLETED, resubmitted.getState());
        assertEquals(RoutingOutcome.PROCEED, resubmitted.getFinalOutcome());
    }

    @Test
    public void testRunIdIsGeneratedWithoutSubmissionId() {
        PipelineRun run = service.process(TestInvoices.technoVision(null, "FV-2025-0051"));

        assertFalse(run.getRunId().isBlank());
        assertTrue(service.findRun(run.getRunId()).isPresent());
    }

    @Test
    public void testNullInvoiceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.process(null));
    }
}
