package org.example.integrationservice.service.worker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.core.util.BackoffSchedule;
import org.example.integrationservice.dto.BatchResult;
import org.example.integrationservice.dto.QueueCounts;
import org.example.integrationservice.model.NotificationJob;
import org.example.integrationservice.model.NotificationStatus;
import org.example.integrationservice.repository.NotificationJobRepository;
import org.example.integrationservice.service.NotificationSender;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Delivers queued notifications: PENDING → SENDING → SENT, back to PENDING on failure, FAILED once attempts run out.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NotificationJobWorker {

    private final NotificationJobRepository notificationJobRepository;
    private final ObjectProvider<NotificationSender> senderProvider;
    private final Clock clock;

    public BatchResult processBatch(Instant now, int limit) {
        NotificationSender sender = senderProvider.getIfAvailable();
        if (sender == null) {
            log.debug("No notification sender configured, leaving {} pending notifications queued", queueDepth());
            return new BatchResult(0, 0, 0, queueDepth(), List.of());
        }

        List<NotificationJob> jobs = notificationJobRepository.findPendingNotifications(now, limit);

        int processed = 0;
        int failed = 0;
        int skipped = 0;
        List<BatchResult.BatchError> errors = new ArrayList<>();

        for (NotificationJob job : jobs) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Notification worker interrupted, leaving remaining jobs for the next run");
                break;
            }

            if (notificationJobRepository.transition(job.getId(), NotificationStatus.PENDING, NotificationStatus.SENDING, clock.instant()) == 0) {
                skipped++;
                continue;
            }

            try {
                String messageId = sender.send(job);
                markSent(job);
                processed++;
                log.info("Notification {} ({}) sent, provider id {}", job.getId(), job.getType(), messageId);
            } catch (RuntimeException e) {
                String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                markFailed(job, error);
                failed++;
                errors.add(new BatchResult.BatchError(job.getId().toString(), error));
            }
        }

        return new BatchResult(processed, failed, skipped, queueDepth(), errors);
    }

    public QueueCounts counts() {
        return new QueueCounts(
                notificationJobRepository.countByStatus(NotificationStatus.PENDING),
                notificationJobRepository.countByStatus(NotificationStatus.SENDING),
                notificationJobRepository.countByStatus(NotificationStatus.SENT),
                notificationJobRepository.countByStatus(NotificationStatus.FAILED)
        );
    }

    public int releaseStale(Duration leaseTimeout) {
        Instant now = clock.instant();
        int released = notificationJobRepository.releaseStale(NotificationStatus.SENDING, NotificationStatus.PENDING, now.minus(leaseTimeout), now);
        if (released > 0) {
            log.warn("Released {} notifications stuck in sending for more than {}", released, leaseTimeout);
        }
        return released;
    }

    private void markSent(NotificationJob job) {
        Instant now = clock.instant();
        job.setStatus(NotificationStatus.SENT);
        job.setAttempts(job.getAttempts() + 1);
        job.setSentAt(now);
        job.setLastError(null);
        job.setUpdatedAt(now);
        notificationJobRepository.save(job);
    }

    private void markFailed(NotificationJob job, String error) {
        Instant now = clock.instant();
        int attempts = job.getAttempts() + 1;
        job.setAttempts(attempts);
        job.setLastError(error.length() > 1000 ? error.substring(0, 1000) : error);
        job.setUpdatedAt(now);

        if (attempts >= job.getMaxAttempts()) {
            job.setStatus(NotificationStatus.FAILED);
            log.error("Notification {} failed permanently after {} attempts: {}", job.getId(), attempts, error);
        } else {
            job.setStatus(NotificationStatus.PENDING);
            job.setRunAfter(BackoffSchedule.nextRunAfter(attempts, now));
            log.warn("Notification {} failed (attempt {}), next run at {}", job.getId(), attempts, job.getRunAfter());
        }
        notificationJobRepository.save(job);
    }

    private long queueDepth() {
        return notificationJobRepository.countByStatus(NotificationStatus.PENDING);
    }
}
