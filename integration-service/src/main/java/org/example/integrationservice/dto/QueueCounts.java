package org.example.integrationservice.dto;

public record QueueCounts(
        long pending,
        long inFlight,
        long completed,
        long failed
) {
}
