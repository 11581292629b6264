package com.apflow.invoice.orchestrator.validation;

import com.apflow.invoice.tools.ToolTimeoutException;
import com.apflow.invoice.tools.ToolUnavailableException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

/**
 * Retry policy for reference checks: retry unavailable and timed-out tools
 * with exponential backoff; protocol errors are never retried.
 */
public class CheckRetryPolicy {

    private final int maxRetries;
    private final long initialBackoffMillis;
    private final double multiplier;
    private final RetryConfig config;

    public CheckRetryPolicy(int maxRetries, long initialBackoffMillis, double multiplier) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.initialBackoffMillis = initialBackoffMillis;
        this.multiplier = multiplier;
        this.config = RetryConfig.custom()
            .maxAttempts(maxRetries + 1)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoffMillis, multiplier))
            .retryExceptions(ToolUnavailableException.class, ToolTimeoutException.class)
            .build();
    }

    /**
     * A fresh retry instance for a single check call.
     */
    public Retry newRetry(String name) {
        return Retry.of(name, config);
    }

    /**
     * Longest time one check can take when every attempt runs for
     * {@code attemptMillis}, backoff waits included.
     */
    public long worstCaseMillis(long attemptMillis) {
        long total = attemptMillis * getMaxAttempts();
        double backoff = initialBackoffMillis;
        for (int retry = 0; retry < maxRetries; retry++) {
            total += (long) backoff;
            backoff *= multiplier;
        }
        return total;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public int getMaxAttempts() {
        return maxRetries + 1;
    }
}
