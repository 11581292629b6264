package com.apflow.invoice.orchestrator.validation;

import com.apflow.invoice.canonical.ExtractedInvoice;
import com.apflow.invoice.canonical.VerificationOutcome;
import com.apflow.invoice.canonical.enums.CheckKind;
import com.apflow.invoice.canonical.enums.ToolErrorType;
import com.apflow.invoice.canonical.enums.VerificationResult;
import com.apflow.invoice.tools.ReferenceToolClient;
import com.apflow.invoice.tools.ToolException;
import com.apflow.invoice.tools.ToolNames;
import com.apflow.invoice.tools.ToolProtocolException;
import com.apflow.invoice.tools.dto.EntityCandidate;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Runs the applicable reference checks for one invoice concurrently and
 * waits for all of them.
 *
 * Each check is retried according to {@link CheckRetryPolicy} and bounded by
 * a per-check deadline that should cover the whole retry budget. A check that cannot be completed settles as a
 * TOOL_ERROR outcome; the fan-in never fails.
 */
public class VerificationFanOut {

    private static final Logger log = LoggerFactory.getLogger(VerificationFanOut.class);

    private final ReferenceToolClient client;
    private final CheckRetryPolicy retryPolicy;
    private final ExecutorService executor;
    private final Clock clock;
    private final long checkDeadlineMillis;

    public VerificationFanOut(ReferenceToolClient client, CheckRetryPolicy retryPolicy, ExecutorService executor,
                              Clock clock, long checkDeadlineMillis) {
        this.client = client;
        this.retryPolicy = retryPolicy;
        this.executor = executor;
        this.clock = clock;
        this.checkDeadlineMillis = checkDeadlineMillis;
    }

    /**
     * Verify every field the invoice carries. Checks whose input fields were not
     * extracted are not issued; the bank check needs both account and routing code.
     *
     * @return one outcome per issued check, in {@link CheckKind} order
     */
    public List<VerificationOutcome> verify(String runId, ExtractedInvoice invoice) {
        String supplierHint = invoice.supplierNameValue();
        List<CompletableFuture<VerificationOutcome>> checks = new ArrayList<>();

        if (invoice.getTaxId().isPresent()) {
            String taxId = invoice.getTaxId().getValue();
            checks.add(launch(runId, CheckKind.TAX_ID, ToolNames.VALIDATE_TAX_ID,
                () -> client.checkTaxId(taxId, supplierHint)));
        }
        if (invoice.getNationalId().isPresent()) {
            String nationalId = invoice.getNationalId().getValue();
            checks.add(launch(runId, CheckKind.NATIONAL_ID, ToolNames.VALIDATE_NATIONAL_ID,
                () -> client.checkNationalId(nationalId)));
        }
        if (invoice.getBankAccountNumber().isPresent() && invoice.getBankRoutingCode().isPresent()) {
            String account = invoice.getBankAccountNumber().getValue();
            String routing = invoice.getBankRoutingCode().getValue();
            checks.add(launch(runId, CheckKind.BANK_ACCOUNT, ToolNames.VALIDATE_SUPPLIER_BANK,
                () -> client.checkBankAccount(account, routing, supplierHint)));
        }
        if (invoice.getPurchaseOrderRef().isPresent()) {
            String reference = invoice.getPurchaseOrderRef().getValue();
            checks.add(launch(runId, CheckKind.PURCHASE_ORDER, ToolNames.VALIDATE_PURCHASE_ORDER,
                () -> client.checkPurchaseOrder(reference)));
        }

        log.info("Verification fan-out - runId={}, stage=VALIDATING, checks={}", runId, checks.size());
        CompletableFuture.allOf(checks.toArray(new CompletableFuture[0])).join();

        List<VerificationOutcome> outcomes = new ArrayList<>();
        for (CompletableFuture<VerificationOutcome> check : checks) {
            outcomes.add(check.join());
        }
        return enrichFromSupplierLookup(runId, supplierHint, outcomes);
    }

    /**
     * The deadline is armed when the check starts running, not while it waits
     * for a verification thread. Once it fires the check is cancelled and no
     * further attempt is made.
     */
    private CompletableFuture<VerificationOutcome> launch(String runId, CheckKind kind, String toolName,
                                                          Supplier<VerificationOutcome> call) {
        AtomicInteger attempts = new AtomicInteger();
        AtomicLong startedAt = new AtomicLong(clock.millis());
        CompletableFuture<VerificationOutcome> settled = new CompletableFuture<>();

        Retry retry = retryPolicy.newRetry(runId + ":" + toolName);
        retry.getEventPublisher().onRetry(event -> log.warn(
            "Retrying check - runId={}, check={}, attempt={}, waitMs={}, error={}",
            runId, kind, event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
            event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage()));

        Supplier<VerificationOutcome> counted = () -> {
            if (settled.isDone()) {
                throw new CancellationException("check " + kind + " already settled");
            }
            attempts.incrementAndGet();
            return call.get();
        };
        Supplier<VerificationOutcome> decorated = Retry.decorateSupplier(retry, counted);

        Future<?> task = executor.submit(() -> {
            startedAt.set(clock.millis());
            settled.orTimeout(checkDeadlineMillis, TimeUnit.MILLISECONDS);
            try {
                settled.complete(decorated.get());
            } catch (RuntimeException e) {
                settled.completeExceptionally(e);
            }
        });
        settled.whenComplete((outcome, failure) -> {
            if (failure instanceof TimeoutException) {
                task.cancel(true);
            }
        });

        return settled
            .thenApply(outcome -> outcome.toBuilder()
                .attempts(attempts.get())
                .latencyMillis(clock.millis() - startedAt.get())
                .build())
            .exceptionally(failure -> toolError(runId, kind, toolName, unwrap(failure), attempts.get(),
                startedAt.get()));
    }

    private VerificationOutcome toolError(String runId, CheckKind kind, String toolName, Throwable failure,
                                          int attempts, long startedAt) {
        ToolErrorType errorType;
        String message;
        if (failure instanceof TimeoutException) {
            errorType = ToolErrorType.TIMEOUT;
            message = "no result within the check deadline of " + checkDeadlineMillis + " ms";
        } else if (failure instanceof ToolException) {
            errorType = ((ToolException) failure).getErrorType();
            message = failure.getMessage();
        } else {
            errorType = ToolErrorType.PROTOCOL;
            message = "unexpected client failure: " + failure;
        }

        if (errorType == ToolErrorType.PROTOCOL) {
            log.error("Tool protocol violation - runId={}, check={}, tool={}, error={}",
                runId, kind, toolName, message, failure);
        } else {
            log.warn("Check unresolved - runId={}, check={}, tool={}, errorType={}, attempts={}, error={}",
                runId, kind, toolName, errorType, attempts, message);
        }
        return VerificationOutcome.toolError(kind, errorType, message, Math.max(attempts, 1),
            clock.millis() - startedAt, clock.instant());
    }

    /**
     * A tax-id or national-id check that found nothing gets the registered
     * value of the supplier as a suggested correction, when the supplier name
     * resolves to exactly one registered supplier. A failed lookup leaves the
     * outcomes unchanged.
     */
    private List<VerificationOutcome> enrichFromSupplierLookup(String runId, String supplierName,
                                                              List<VerificationOutcome> outcomes) {
        boolean needsLookup = outcomes.stream().anyMatch(VerificationFanOut::wantsSuggestion);
        if (!needsLookup || supplierName == null) {
            return outcomes;
        }

        List<EntityCandidate> candidates;
        try {
            candidates = client.lookupEntity(supplierName);
        } catch (ToolProtocolException e) {
            log.error("Tool protocol violation - runId={}, tool={}, error={}",
                runId, e.getToolName(), e.getMessage(), e);
            return outcomes;
        } catch (ToolException e) {
            log.warn("Supplier lookup failed, keeping outcomes - runId={}, tool={}, errorType={}, error={}",
                runId, e.getToolName(), e.getErrorType(), e.getMessage());
            return outcomes;
        }
        if (candidates.size() != 1) {
            log.info("Supplier lookup not conclusive - runId={}, supplierName={}, candidates={}",
                runId, supplierName, candidates.size());
            return outcomes;
        }

        EntityCandidate candidate = candidates.get(0);
        List<VerificationOutcome> enriched = new ArrayList<>(outcomes.size());
        for (VerificationOutcome outcome : outcomes) {
            String suggestion = null;
            if (wantsSuggestion(outcome)) {
                suggestion = outcome.getCheckKind() == CheckKind.TAX_ID
                    ? candidate.getTaxId() : candidate.getNationalId();
            }
            if (suggestion == null) {
                enriched.add(outcome);
                continue;
            }
            log.info("Suggested correction from supplier lookup - runId={}, check={}, supplierId={}",
                runId, outcome.getCheckKind(), candidate.getSupplierId());
            enriched.add(outcome.toBuilder()
                .canonicalValue(suggestion)
                .message(appendMessage(outcome.getMessage(),
                    "registered supplier " + candidate.getName() + " uses " + suggestion))
                .build());
        }
        return enriched;
    }

    private static boolean wantsSuggestion(VerificationOutcome outcome) {
        return outcome.getResult() == VerificationResult.NOT_FOUND
            && outcome.getCanonicalValue() == null
            && (outcome.getCheckKind() == CheckKind.TAX_ID || outcome.getCheckKind() == CheckKind.NATIONAL_ID);
    }

    private static String appendMessage(String message, String addition) {
        return message == null ? addition : message + "; " + addition;
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
