package org.example.integrationservice;

import org.example.integrationservice.client.ats.AtsApiMetrics;
import org.example.integrationservice.client.ats.AtsHealthStatus;
import org.example.integrationservice.client.ats.dto.AtsMetricsSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class AtsApiMetricsTest {

    private MutableClock clock;
    private AtsApiMetrics metrics;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T09:00:00Z"));
        metrics = new AtsApiMetrics(clock);
    }

    @Test
    @DisplayName("Should report HEALTHY with no traffic")
    void testHealth_NoCalls() {
        assertThat(metrics.health()).isEqualTo(AtsHealthStatus.HEALTHY);
    }

    @Test
    @DisplayName("Should degrade below 95% and go down below 80% success")
    void testHealth_SuccessRateThresholds() {
        for (int i = 0; i < 9; i++) {
            metrics.recordSuccess(10);
        }
        metrics.recordFailure(10, 500, "boom");
        assertThat(metrics.health()).isEqualTo(AtsHealthStatus.DEGRADED);

        metrics.recordFailure(10, 503, "boom");
        metrics.recordFailure(10, null, "reset");
        assertThat(metrics.health()).isEqualTo(AtsHealthStatus.DOWN);
    }

    @Test
    @DisplayName("Should report DOWN for five minutes after an auth failure")
    void testHealth_RecentAuthFailure() {
        for (int i = 0; i < 50; i++) {
            metrics.recordSuccess(10);
        }
        metrics.recordFailure(10, 401, "Unauthorized");
        assertThat(metrics.health()).isEqualTo(AtsHealthStatus.DOWN);

        clock.advance(Duration.ofMinutes(6));
        assertThat(metrics.health()).isEqualTo(AtsHealthStatus.HEALTHY);
    }

    @Test
    @DisplayName("Should bucket failures and drop calls older than 24h from the window")
    void testSnapshot_CountersAndWindow() {
        metrics.recordSuccess(20);
        metrics.recordFailure(40, 429, "rate limited");
        metrics.recordFailure(60, null, "reset");

        AtsMetricsSnapshot snapshot = metrics.snapshot();
        assertThat(snapshot.requestCount()).isEqualTo(3);
        assertThat(snapshot.rateLimitCount()).isEqualTo(1);
        assertThat(snapshot.networkErrorCount()).isEqualTo(1);
        assertThat(snapshot.averageLatencyMs()).isEqualTo(40);
        assertThat(snapshot.callsLast24h()).isEqualTo(3);
        assertThat(snapshot.failedCallsLast24h()).isEqualTo(2);
        assertThat(snapshot.lastError()).isEqualTo("reset");

        clock.advance(Duration.ofHours(25));
        AtsMetricsSnapshot later = metrics.snapshot();
        assertThat(later.requestCount()).isEqualTo(3);
        assertThat(later.callsLast24h()).isZero();
    }
}
