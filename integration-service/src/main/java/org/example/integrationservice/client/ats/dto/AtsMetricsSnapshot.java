package org.example.integrationservice.client.ats.dto;

import java.time.Instant;

public record AtsMetricsSnapshot(
        long requestCount,
        long successCount,
        long failureCount,
        long rateLimitCount,
        long serverErrorCount,
        long authFailureCount,
        long networkErrorCount,
        long averageLatencyMs,
        Instant lastSuccessAt,
        Instant lastFailureAt,
        String lastError,
        long callsLast24h,
        long failedCallsLast24h
) {
}
