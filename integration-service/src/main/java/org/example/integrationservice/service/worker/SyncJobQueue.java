package org.example.integrationservice.service.worker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.core.exception.InvalidJobStateException;
import org.example.integrationservice.core.exception.SyncJobNotFoundException;
import org.example.integrationservice.dto.QueueCounts;
import org.example.integrationservice.model.AuditAction;
import org.example.integrationservice.model.SyncEntityType;
import org.example.integrationservice.model.SyncJob;
import org.example.integrationservice.model.SyncJobStatus;
import org.example.integrationservice.repository.SyncJobRepository;
import org.example.integrationservice.service.AuditService;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Persistence-backed queue of ATS writes awaiting retry.
 * Claims are compare-and-set updates on the status column, so overlapping workers never run the same job twice.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SyncJobQueue {

    private final SyncJobRepository syncJobRepository;
    private final AuditService auditService;
    private final Clock clock;

    public List<SyncJob> getPendingSyncJobs(int limit) {
        return getPendingSyncJobs(clock.instant(), limit);
    }

    public List<SyncJob> getPendingSyncJobs(Instant now, int limit) {
        return syncJobRepository.findPendingSyncJobs(now, limit);
    }

    /**
     * @return false when the job is no longer pending, typically because another worker took it
     */
    public boolean claim(SyncJob job) {
        Instant now = clock.instant();
        boolean claimed = syncJobRepository.transition(job.getId(), SyncJobStatus.PENDING, SyncJobStatus.PROCESSING, now) == 1;
        if (claimed) {
            job.setStatus(SyncJobStatus.PROCESSING);
            job.setUpdatedAt(now);
        }
        return claimed;
    }

    public SyncJob save(SyncJob job) {
        job.setUpdatedAt(clock.instant());
        return syncJobRepository.save(job);
    }

    public long queueDepth() {
        return syncJobRepository.countByStatus(SyncJobStatus.PENDING);
    }

    public QueueCounts counts() {
        return new QueueCounts(
                syncJobRepository.countByStatus(SyncJobStatus.PENDING),
                syncJobRepository.countByStatus(SyncJobStatus.PROCESSING),
                syncJobRepository.countByStatus(SyncJobStatus.COMPLETED),
                syncJobRepository.countByStatus(SyncJobStatus.FAILED)
        );
    }

    /**
     * Hands jobs abandoned in processing (worker crash, killed pod) back to the queue.
     */
    public int releaseStale(Duration leaseTimeout) {
        Instant now = clock.instant();
        int released = syncJobRepository.releaseStale(SyncJobStatus.PROCESSING, SyncJobStatus.PENDING, now.minus(leaseTimeout), now);
        if (released > 0) {
            log.warn("Released {} sync jobs stuck in processing for more than {}", released, leaseTimeout);
        }
        return released;
    }

    /**
     * Puts a permanently failed job back in line with a fresh attempt budget.
     */
    @Transactional
    public SyncJob requeue(UUID jobId) {
        SyncJob job = syncJobRepository.findById(jobId)
                .orElseThrow(() -> new SyncJobNotFoundException(jobId));

        if (job.getStatus() != SyncJobStatus.FAILED) {
            throw new InvalidJobStateException("Only failed sync jobs can be requeued, job " + jobId + " is " + job.getStatus());
        }

        Instant now = clock.instant();
        job.setStatus(SyncJobStatus.PENDING);
        job.setAttempts(0);
        job.setRunAfter(now);
        job.setUpdatedAt(now);
        SyncJob saved = syncJobRepository.save(job);

        auditService.record(AuditAction.SYNC_JOB_REQUEUED,
                job.getEntityType() == SyncEntityType.SCHEDULING_REQUEST ? job.getEntityId() : null,
                job.getEntityType() == SyncEntityType.BOOKING ? job.getEntityId() : null,
                Map.of("syncJobId", jobId.toString()));

        log.info("Sync job {} requeued manually", jobId);
        return saved;
    }
}
