package org.example.integrationservice.client.calendar.dto;

import java.time.Instant;

/**
 * @param valid            a token is cached and has not expired yet; it may still be inside the early-refresh window
 * @param expiresInSeconds {@code null} when nothing is cached
 */
public record TokenStatus(
        boolean valid,
        Instant expiresAt,
        Long expiresInSeconds
) {
}
