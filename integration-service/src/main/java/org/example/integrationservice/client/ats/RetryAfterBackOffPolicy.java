package org.example.integrationservice.client.ats;

import org.example.integrationservice.client.ats.exception.AtsRateLimitException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Honours the server's Retry-After on a 429, otherwise waits {@code base * 2^n} plus up to {@code base} of jitter,
 * capped at {@code max}.
 */
public class RetryAfterBackOffPolicy implements BackOffPolicy {

    private static final int MAX_EXPONENT = 20;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final Sleeper sleeper;

    private record RetryAwareContext(RetryContext retryContext) implements BackOffContext {
    }

    public RetryAfterBackOffPolicy(Duration baseDelay, Duration maxDelay, Sleeper sleeper) {
        this.baseDelayMs = baseDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new RetryAwareContext(context);
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        RetryContext context = ((RetryAwareContext) backOffContext).retryContext();
        long delay = delayFor(context.getLastThrowable(), context.getRetryCount());
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted while waiting to retry ATS call", e);
        }
    }

    /**
     * @param retryCount failed attempts so far, so the first back-off sees {@code 1}
     */
    public long delayFor(Throwable lastFailure, int retryCount) {
        if (lastFailure instanceof AtsRateLimitException rateLimit && rateLimit.getRetryAfter() != null) {
            return rateLimit.getRetryAfter().toMillis();
        }
        int exponent = Math.min(Math.max(retryCount - 1, 0), MAX_EXPONENT);
        long exponential = baseDelayMs * (1L << exponent);
        long jitter = baseDelayMs > 0 ? ThreadLocalRandom.current().nextLong(baseDelayMs) : 0;
        return Math.min(exponential + jitter, maxDelayMs);
    }
}
