package org.example.integrationservice.dto.ops;

import org.example.integrationservice.client.ats.AtsHealthStatus;
import org.example.integrationservice.client.ats.dto.AtsMetricsSnapshot;
import org.example.integrationservice.client.calendar.dto.TokenMetrics;
import org.example.integrationservice.client.calendar.dto.TokenStatus;
import org.example.integrationservice.dto.QueueCounts;

public record IntegrationStatus(
        TokenStatus calendarToken,
        TokenMetrics calendarTokenMetrics,
        AtsHealthStatus atsHealth,
        AtsMetricsSnapshot atsMetrics,
        QueueCounts syncJobs,
        QueueCounts notifications,
        QueueCounts webhookEvents
) {
}
