package org.example.integrationservice.core.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Retry queue tunables shared by the sync and notification workers.
 *
 * YAML prefix: {@code app.sync}
 */
@Getter
@Setter
@ToString
@Validated
@ConfigurationProperties(prefix = "app.sync")
public class SyncProperties {

    /** Attempts a sync job gets before it is marked failed. */
    @Min(1)
    private int maxAttempts = 5;

    /** Jobs claimed per worker tick. */
    @Min(1)
    private int batchSize = 10;

    /** Wall-clock budget of one worker tick; remaining jobs wait for the next one. */
    @NotNull
    private Duration batchTimeout = Duration.ofSeconds(50);

    /** Jobs left in processing longer than this are handed back to the queue. */
    @NotNull
    private Duration staleLeaseTimeout = Duration.ofMinutes(15);

    /** Attempts a notification gets before it is marked failed. */
    @Min(1)
    private int notificationMaxAttempts = 5;

    /** Notifications claimed per worker tick. */
    @Min(1)
    private int notificationBatchSize = 10;
}
