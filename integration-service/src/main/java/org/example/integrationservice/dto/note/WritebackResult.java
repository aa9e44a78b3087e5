package org.example.integrationservice.dto.note;

import java.util.UUID;

/**
 * Outcome of one writeback. A failed write that was queued for retry carries the id of the new sync job.
 */
public record WritebackResult(
        boolean success,
        String error,
        UUID syncJobId
) {
    public static WritebackResult ok() {
        return new WritebackResult(true, null, null);
    }

    public static WritebackResult failed(String error) {
        return new WritebackResult(false, error, null);
    }

    public static WritebackResult queued(String error, UUID syncJobId) {
        return new WritebackResult(false, error, syncJobId);
    }
}
