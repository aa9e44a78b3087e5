package org.example.integrationservice.dto;

import java.util.List;

/**
 * Summary of one worker tick.
 *
 * @param processed  items that reached their success state
 * @param failed     items whose attempt failed, whether rescheduled or parked
 * @param skipped    items another worker claimed first
 * @param queueDepth items still pending after the tick
 */
public record BatchResult(
        int processed,
        int failed,
        int skipped,
        long queueDepth,
        List<BatchError> errors
) {
    public record BatchError(String itemId, String error) {
    }

    public boolean isEmpty() {
        return processed == 0 && failed == 0 && skipped == 0;
    }
}
