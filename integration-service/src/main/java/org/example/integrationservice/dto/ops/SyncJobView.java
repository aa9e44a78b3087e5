package org.example.integrationservice.dto.ops;

import org.example.integrationservice.model.SyncJob;
import org.example.integrationservice.model.SyncJobStatus;

import java.time.Instant;
import java.util.UUID;

public record SyncJobView(
        UUID id,
        String entityType,
        String entityId,
        SyncJobStatus status,
        int attempts,
        int maxAttempts,
        Instant runAfter,
        String lastError
) {
    public static SyncJobView from(SyncJob job) {
        return new SyncJobView(job.getId(), job.getEntityType().getValue(), job.getEntityId(), job.getStatus(),
                job.getAttempts(), job.getMaxAttempts(), job.getRunAfter(), job.getLastError());
    }
}
