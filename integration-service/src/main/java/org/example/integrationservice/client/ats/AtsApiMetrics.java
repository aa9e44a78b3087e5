package org.example.integrationservice.client.ats;

import org.example.integrationservice.client.ats.dto.AtsMetricsSnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per-client call counters. Every HTTP attempt counts, retries included.
 */
public class AtsApiMetrics {

    static final Duration WINDOW = Duration.ofHours(24);
    static final Duration AUTH_FAILURE_GRACE = Duration.ofMinutes(5);
    static final double DOWN_SUCCESS_RATE = 0.80;
    static final double DEGRADED_SUCCESS_RATE = 0.95;

    private record Sample(Instant at, boolean success) {
    }

    private final Clock clock;
    private final Deque<Sample> recent = new ArrayDeque<>();

    private long requestCount;
    private long successCount;
    private long failureCount;
    private long rateLimitCount;
    private long serverErrorCount;
    private long authFailureCount;
    private long networkErrorCount;
    private long totalLatencyMs;
    private Instant lastSuccessAt;
    private Instant lastFailureAt;
    private Instant lastAuthFailureAt;
    private String lastError;

    public AtsApiMetrics(Clock clock) {
        this.clock = clock;
    }

    public synchronized void recordSuccess(long latencyMs) {
        Instant now = clock.instant();
        requestCount++;
        successCount++;
        totalLatencyMs += latencyMs;
        lastSuccessAt = now;
        recent.addLast(new Sample(now, true));
        prune(now);
    }

    public synchronized void recordFailure(long latencyMs, Integer statusCode, String errorMessage) {
        Instant now = clock.instant();
        requestCount++;
        failureCount++;
        totalLatencyMs += latencyMs;
        lastFailureAt = now;
        lastError = errorMessage;

        if (statusCode == null) {
            networkErrorCount++;
        } else if (statusCode == 429) {
            rateLimitCount++;
        } else if (statusCode >= 500) {
            serverErrorCount++;
        } else if (statusCode == 401 || statusCode == 403) {
            authFailureCount++;
            lastAuthFailureAt = now;
        }

        recent.addLast(new Sample(now, false));
        prune(now);
    }

    public synchronized AtsMetricsSnapshot snapshot() {
        prune(clock.instant());
        long failedRecent = recent.stream().filter(s -> !s.success()).count();
        return new AtsMetricsSnapshot(
                requestCount,
                successCount,
                failureCount,
                rateLimitCount,
                serverErrorCount,
                authFailureCount,
                networkErrorCount,
                requestCount == 0 ? 0 : Math.round((double) totalLatencyMs / requestCount),
                lastSuccessAt,
                lastFailureAt,
                lastError,
                recent.size(),
                failedRecent
        );
    }

    public synchronized AtsHealthStatus health() {
        Instant now = clock.instant();
        prune(now);

        if (lastAuthFailureAt != null && lastAuthFailureAt.isAfter(now.minus(AUTH_FAILURE_GRACE))) {
            return AtsHealthStatus.DOWN;
        }
        if (recent.isEmpty()) {
            return AtsHealthStatus.HEALTHY;
        }

        long successes = recent.stream().filter(Sample::success).count();
        double successRate = (double) successes / recent.size();
        if (successRate < DOWN_SUCCESS_RATE) {
            return AtsHealthStatus.DOWN;
        }
        if (successRate < DEGRADED_SUCCESS_RATE) {
            return AtsHealthStatus.DEGRADED;
        }
        return AtsHealthStatus.HEALTHY;
    }

    public synchronized void reset() {
        recent.clear();
        requestCount = 0;
        successCount = 0;
        failureCount = 0;
        rateLimitCount = 0;
        serverErrorCount = 0;
        authFailureCount = 0;
        networkErrorCount = 0;
        totalLatencyMs = 0;
        lastSuccessAt = null;
        lastFailureAt = null;
        lastAuthFailureAt = null;
        lastError = null;
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(WINDOW);
        while (!recent.isEmpty() && recent.peekFirst().at().isBefore(cutoff)) {
            recent.removeFirst();
        }
    }
}
