package org.example.integrationservice.core.util;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Fixed retry ladder for queued jobs: 1, 5, 15, 30 then 60 minutes for every later attempt.
 */
public final class BackoffSchedule {

    private static final List<Duration> DELAYS = List.of(
            Duration.ofMinutes(1),
            Duration.ofMinutes(5),
            Duration.ofMinutes(15),
            Duration.ofMinutes(30),
            Duration.ofMinutes(60)
    );

    private BackoffSchedule() {
    }

    /**
     * @param attempts attempts made so far, the first retry is scheduled with {@code 0}
     */
    public static Duration delayFor(int attempts) {
        int index = Math.min(Math.max(attempts, 0), DELAYS.size() - 1);
        return DELAYS.get(index);
    }

    public static Instant nextRunAfter(int attempts, Instant from) {
        return from.plus(delayFor(attempts));
    }
}
