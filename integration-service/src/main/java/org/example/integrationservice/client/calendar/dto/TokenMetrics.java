package org.example.integrationservice.client.calendar.dto;

import java.time.Instant;

public record TokenMetrics(
        long tokenRefreshes,
        long tokenFailures,
        Instant lastRefreshAt,
        Instant lastFailureAt,
        String lastError
) {
}
