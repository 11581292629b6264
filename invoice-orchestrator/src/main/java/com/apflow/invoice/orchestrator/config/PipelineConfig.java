package com.apflow.invoice.orchestrator.config;

import com.apflow.invoice.notification.NotificationService;
import com.apflow.invoice.orchestrator.PipelineRunRepository;
import com.apflow.invoice.orchestrator.RunOutcomePublisher;
import com.apflow.invoice.orchestrator.notification.NotificationDispatcher;
import com.apflow.invoice.orchestrator.report.ReportFactory;
import com.apflow.invoice.orchestrator.validation.CheckRetryPolicy;
import com.apflow.invoice.orchestrator.validation.InvoiceIntakeValidator;
import com.apflow.invoice.orchestrator.validation.VerificationFanOut;
import com.apflow.invoice.rules.ConfidenceAggregator;
import com.apflow.invoice.rules.InvoiceBusinessRules;
import com.apflow.invoice.rules.RoutingDecisionEngine;
import com.apflow.invoice.rules.ValidationPolicy;
import com.apflow.invoice.rules.ValidationPolicyLoader;
import com.apflow.invoice.tools.ReferenceToolClient;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Pipeline wiring: policy, rule engines, worker pools, and the outbound
 * notification and final status channels.
 *
 * In mock mode ({@code pipeline.mock.mode=true}) nothing connects to Kafka;
 * notifications and final status records are only kept in memory and logged.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    static final long DEADLINE_MARGIN_MS = 500;

    @Value("${kafka.bootstrap.servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${pipeline.mock.mode:false}")
    private boolean mockMode;

    @Value("${pipeline.policy.path:" + ValidationPolicyLoader.DEFAULT_POLICY_PATH + "}")
    private String policyPath;

    @Bean
    public Clock pipelineClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ValidationPolicy validationPolicy() {
        ValidationPolicy policy = new ValidationPolicyLoader().loadPolicy(policyPath);
        log.info("Validation policy loaded - path={}, proceedThreshold={}, fieldPassThreshold={}, maxToolErrorsBeforeReview={}",
            policyPath, policy.getProceedThreshold(), policy.getFieldPassThreshold(), policy.getMaxToolErrorsBeforeReview());
        return policy;
    }

    @Bean
    public ConfidenceAggregator confidenceAggregator(ValidationPolicy policy) {
        return new ConfidenceAggregator(policy);
    }

    @Bean
    public InvoiceBusinessRules invoiceBusinessRules(ValidationPolicy policy) {
        return new InvoiceBusinessRules(policy);
    }

    @Bean
    public RoutingDecisionEngine routingDecisionEngine(ValidationPolicy policy) {
        return new RoutingDecisionEngine(policy);
    }

    @Bean
    public CheckRetryPolicy checkRetryPolicy(
            @Value("${pipeline.retry.max-retries:2}") int maxRetries,
            @Value("${pipeline.retry.initial-backoff-ms:200}") long initialBackoffMillis,
            @Value("${pipeline.retry.multiplier:2.0}") double multiplier) {
        return new CheckRetryPolicy(maxRetries, initialBackoffMillis, multiplier);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService verificationExecutor(@Value("${pipeline.verification.threads:8}") int threads) {
        return Executors.newFixedThreadPool(threads);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService pipelineRunExecutor(@Value("${pipeline.workers:4}") int workers) {
        return Executors.newFixedThreadPool(workers);
    }

    @Bean
    public InvoiceIntakeValidator invoiceIntakeValidator(Validator validator) {
        return new InvoiceIntakeValidator(validator);
    }

    @Bean
    public VerificationFanOut verificationFanOut(ReferenceToolClient toolClient,
                                                 CheckRetryPolicy retryPolicy,
                                                 @Qualifier("verificationExecutor") ExecutorService executor,
                                                 Clock clock,
                                                 @Value("${pipeline.check.deadline-ms:0}") long deadlineMillis,
                                                 @Value("${reference-tools.connect-timeout-ms:1000}") long connectTimeoutMillis,
                                                 @Value("${reference-tools.read-timeout-ms:3000}") long readTimeoutMillis) {
        return new VerificationFanOut(toolClient, retryPolicy, executor, clock,
            checkDeadline(retryPolicy, deadlineMillis, connectTimeoutMillis + readTimeoutMillis));
    }

    /**
     * A deadline of 0 is derived from the retry budget. An explicit deadline
     * shorter than the budget would cut retries off and is refused.
     */
    static long checkDeadline(CheckRetryPolicy retryPolicy, long deadlineMillis, long attemptMillis) {
        long budget = retryPolicy.worstCaseMillis(attemptMillis);
        if (deadlineMillis <= 0) {
            long derived = budget + DEADLINE_MARGIN_MS;
            log.info("Check deadline derived from retry budget - maxAttempts={}, attemptMs={}, deadlineMs={}",
                retryPolicy.getMaxAttempts(), attemptMillis, derived);
            return derived;
        }
        if (deadlineMillis < budget) {
            throw new IllegalStateException("pipeline.check.deadline-ms=" + deadlineMillis
                + " is shorter than the retry budget of " + budget + " ms ("
                + retryPolicy.getMaxAttempts() + " attempts of " + attemptMillis + " ms plus backoff)");
        }
        return deadlineMillis;
    }

    @Bean
    public ReportFactory reportFactory(Clock clock) {
        return new ReportFactory(clock);
    }

    @Bean
    public PipelineRunRepository pipelineRunRepository() {
        return new PipelineRunRepository();
    }

    @Bean(destroyMethod = "shutdown")
    public NotificationDispatcher notificationDispatcher(
            Clock clock,
            @Value("${pipeline.notifications.retained:" + NotificationDispatcher.DEFAULT_RETAINED + "}") int retained) {
        if (mockMode) {
            log.info("Running in MOCK MODE - notifications will not be published to Kafka");
            return new NotificationDispatcher(null, clock, retained);
        }
        return new NotificationDispatcher(new NotificationService(bootstrapServers), clock, retained);
    }

    @Bean(destroyMethod = "shutdown")
    public RunOutcomePublisher runOutcomePublisher() {
        if (mockMode) {
            log.info("Running in MOCK MODE - final status will not be published to Kafka");
            return RunOutcomePublisher.mock();
        }
        return RunOutcomePublisher.kafka(bootstrapServers);
    }
}
