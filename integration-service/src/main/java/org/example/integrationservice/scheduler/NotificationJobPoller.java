package org.example.integrationservice.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.core.config.SyncProperties;
import org.example.integrationservice.dto.BatchResult;
import org.example.integrationservice.service.worker.NotificationJobWorker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(value = "scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class NotificationJobPoller {

    private final NotificationJobWorker notificationJobWorker;
    private final SyncProperties syncProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.notifications.poll-interval:30000}")
    public void sendNotifications() {
        try {
            BatchResult result = notificationJobWorker.processBatch(clock.instant(), syncProperties.getNotificationBatchSize());
            if (!result.isEmpty()) {
                log.info("Notifications: {} sent, {} failed, {} skipped, {} still pending",
                        result.processed(), result.failed(), result.skipped(), result.queueDepth());
            }
        } catch (Exception e) {
            log.error("Notification run failed: {}", e.getMessage(), e);
        }
    }
}
