package com.apflow.invoice.orchestrator.notification;

import com.apflow.invoice.canonical.RoutingDecision;
import com.apflow.invoice.canonical.RunReport;
import com.apflow.invoice.canonical.enums.RoutingOutcome;
import com.apflow.invoice.notification.NotificationService;
import com.apflow.invoice.notification.ReviewNotification;
import com.apflow.invoice.orchestrator.state.PipelineRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tells a user about runs that ended in REJECT or MANUAL_REVIEW.
 *
 * At most one notification per run attempt; PROCEED and failed runs never notify.
 * Without a notification service (mock mode) notifications are only recorded and logged.
 * Only the most recent notifications are retained, oldest evicted first.
 */
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    public static final int DEFAULT_RETAINED = 1000;

    private final NotificationService notificationService;
    private final Clock clock;
    private final int retained;
    private final Set<String> notifiedAttempts;
    private final Deque<ReviewNotification> history = new ArrayDeque<>();

    public NotificationDispatcher(NotificationService notificationService, Clock clock) {
        this(notificationService, clock, DEFAULT_RETAINED);
    }

    public NotificationDispatcher(NotificationService notificationService, Clock clock, int retained) {
        if (retained < 1) {
            throw new IllegalArgumentException("retained must be positive: " + retained);
        }
        this.notificationService = notificationService;
        this.clock = clock;
        this.retained = retained;
        this.notifiedAttempts = Collections.synchronizedSet(Collections.newSetFromMap(
            new LinkedHashMap<String, Boolean>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                    return size() > NotificationDispatcher.this.retained;
                }
            }));
    }

    /**
     * @return true if a notification was sent for this call
     */
    public boolean notifyOutcome(PipelineRun run) {
        RoutingOutcome outcome = run.getFinalOutcome();
        if (outcome == null || !outcome.requiresNotification()) {
            return false;
        }
        if (!notifiedAttempts.add(run.getRunId() + "#" + run.getAttempt())) {
            log.debug("Notification already sent - runId={}, attempt={}", run.getRunId(), run.getAttempt());
            return false;
        }

        ReviewNotification notification = ReviewNotification.builder()
            .runId(run.getRunId())
            .attempt(run.getAttempt())
            .outcome(outcome)
            .invoiceNumber(run.getInvoice().invoiceNumberValue())
            .supplierName(run.getInvoice().supplierNameValue())
            .summary(summarise(outcome, run.getDecision(), run.getReport()))
            .report(run.getReport())
            .sentAt(Instant.now(clock))
            .build();
        synchronized (history) {
            history.addLast(notification);
            if (history.size() > retained) {
                history.removeFirst();
            }
        }

        if (notificationService == null) {
            log.info("Mock mode: notification recorded - runId={}, outcome={}", run.getRunId(), outcome);
            return true;
        }
        try {
            notificationService.publish(notification);
        } catch (RuntimeException e) {
            log.error("Failed to publish notification - runId={}, outcome={}", run.getRunId(), outcome, e);
        }
        return true;
    }

    public List<ReviewNotification> getHistory() {
        synchronized (history) {
            return Collections.unmodifiableList(new ArrayList<>(history));
        }
    }

    public List<ReviewNotification> getHistory(String runId) {
        return getHistory().stream()
            .filter(n -> n.getRunId().equals(runId))
            .collect(Collectors.toList());
    }

    public void shutdown() {
        if (notificationService != null) {
            notificationService.shutdown();
        }
    }

    private static String summarise(RoutingOutcome outcome, RoutingDecision decision, RunReport report) {
        String verdict = outcome == RoutingOutcome.REJECT ? "Invoice rejected" : "Invoice needs manual review";
        if (report != null && !report.getEntries().isEmpty()) {
            return verdict + ": " + report.getEntries().stream()
                .map(e -> e.getField() + " (" + e.getReason() + ")")
                .collect(Collectors.joining(", "));
        }
        if (decision != null && !decision.getReasons().isEmpty()) {
            return verdict + ": " + String.join(", ", decision.getReasons());
        }
        return verdict;
    }
}
