package org.example.integrationservice.service.worker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.core.util.BackoffSchedule;
import org.example.integrationservice.dto.BatchResult;
import org.example.integrationservice.dto.note.WritebackResult;
import org.example.integrationservice.model.AuditAction;
import org.example.integrationservice.model.SyncEntityType;
import org.example.integrationservice.model.SyncJob;
import org.example.integrationservice.model.SyncJobStatus;
import org.example.integrationservice.service.AuditService;
import org.example.integrationservice.service.WritebackService;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays queued ATS writes.
 * <p>
 * pending → processing → completed | pending (rescheduled) | failed. The deadline and interrupt flag are only
 * looked at between jobs, so a job that was started always has its outcome recorded.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SyncJobWorker {

    private static final int MAX_AUDIT_ERROR_LENGTH = 500;
    private static final int MAX_LAST_ERROR_LENGTH = 1000;

    private final SyncJobQueue syncJobQueue;
    private final WritebackService writebackService;
    private final AuditService auditService;
    private final Clock clock;

    enum Outcome {
        COMPLETED,
        RESCHEDULED,
        FAILED,
        SKIPPED
    }

    public BatchResult processBatch(Instant now, int limit) {
        return processBatch(now, limit, null);
    }

    /**
     * @param deadline jobs not started by this instant are left for the next tick, may be null
     */
    public BatchResult processBatch(Instant now, int limit, Instant deadline) {
        List<SyncJob> jobs = syncJobQueue.getPendingSyncJobs(now, limit);

        int processed = 0;
        int failed = 0;
        int skipped = 0;
        List<BatchResult.BatchError> errors = new ArrayList<>();

        for (SyncJob job : jobs) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Sync worker interrupted, leaving remaining jobs for the next run");
                break;
            }
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                log.warn("Sync worker reached its deadline, leaving remaining jobs for the next run");
                break;
            }

            Outcome outcome;
            try {
                outcome = processJob(job);
            } catch (RuntimeException e) {
                // job stays in processing and is handed back by the stale-lease release
                log.error("Sync job {} could not be recorded: {}", job.getId(), e.getMessage(), e);
                failed++;
                errors.add(new BatchResult.BatchError(job.getId().toString(), truncate(String.valueOf(e.getMessage()), MAX_AUDIT_ERROR_LENGTH)));
                continue;
            }
            switch (outcome) {
                case COMPLETED -> processed++;
                case SKIPPED -> skipped++;
                case RESCHEDULED, FAILED -> {
                    failed++;
                    errors.add(new BatchResult.BatchError(job.getId().toString(), job.getLastError()));
                }
            }
        }

        return new BatchResult(processed, failed, skipped, syncJobQueue.queueDepth(), errors);
    }

    Outcome processJob(SyncJob job) {
        if (!syncJobQueue.claim(job)) {
            log.debug("Sync job {} already claimed elsewhere", job.getId());
            return Outcome.SKIPPED;
        }

        WritebackResult result;
        try {
            result = writebackService.retryJob(job);
        } catch (RuntimeException e) {
            result = WritebackResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        if (result.success()) {
            job.setStatus(SyncJobStatus.COMPLETED);
            syncJobQueue.save(job);
            auditService.record(AuditAction.SYNC_JOB_SUCCESS, requestId(job), bookingId(job), auditFields(job, job.getAttempts() + 1, null));
            log.info("Sync job {} completed", job.getId());
            return Outcome.COMPLETED;
        }

        return handleFailure(job, result.error() != null ? result.error() : "Unknown error");
    }

    private Outcome handleFailure(SyncJob job, String error) {
        int attempts = job.getAttempts() + 1;
        job.setAttempts(attempts);
        job.setLastError(truncate(error, MAX_LAST_ERROR_LENGTH));

        if (attempts >= job.getMaxAttempts()) {
            job.setStatus(SyncJobStatus.FAILED);
            syncJobQueue.save(job);
            auditService.record(AuditAction.SYNC_JOB_FAILED, requestId(job), bookingId(job), auditFields(job, attempts, error));
            log.error("Sync job {} failed permanently after {} attempts: {}", job.getId(), attempts, job.getLastError());
            return Outcome.FAILED;
        }

        job.setStatus(SyncJobStatus.PENDING);
        job.setRunAfter(BackoffSchedule.nextRunAfter(attempts, clock.instant()));
        syncJobQueue.save(job);
        log.warn("Sync job {} failed (attempt {}/{}), next run at {}", job.getId(), attempts, job.getMaxAttempts(), job.getRunAfter());
        return Outcome.RESCHEDULED;
    }

    private static Map<String, Object> auditFields(SyncJob job, int attempts, String error) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("syncJobId", job.getId().toString());
        fields.put("type", job.getType().name());
        fields.put("attempts", attempts);
        if (error != null) {
            fields.put("error", truncate(error, MAX_AUDIT_ERROR_LENGTH));
        }
        return fields;
    }

    private static String truncate(String value, int maxLength) {
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }

    private static String requestId(SyncJob job) {
        return job.getEntityType() == SyncEntityType.SCHEDULING_REQUEST ? job.getEntityId() : null;
    }

    private static String bookingId(SyncJob job) {
        return job.getEntityType() == SyncEntityType.BOOKING ? job.getEntityId() : null;
    }
}
