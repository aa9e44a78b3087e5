package org.example.integrationservice.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.core.config.SyncProperties;
import org.example.integrationservice.service.worker.NotificationJobWorker;
import org.example.integrationservice.service.worker.SyncJobQueue;
import org.example.integrationservice.service.worker.WebhookEventWorker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * A worker that dies mid-item leaves it in its in-flight state forever; this hands such items back to their queues.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(value = "scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class StaleJobRecoveryScheduler {

    private final SyncJobQueue syncJobQueue;
    private final NotificationJobWorker notificationJobWorker;
    private final WebhookEventWorker webhookEventWorker;
    private final SyncProperties syncProperties;

    @Scheduled(fixedDelay = 300_000)
    public void recoverStuckJobs() {
        try {
            syncJobQueue.releaseStale(syncProperties.getStaleLeaseTimeout());
            notificationJobWorker.releaseStale(syncProperties.getStaleLeaseTimeout());
            webhookEventWorker.releaseStale(syncProperties.getStaleLeaseTimeout());
        } catch (Exception e) {
            log.error("Critical: failed to recover stuck jobs", e);
        }
    }
}
