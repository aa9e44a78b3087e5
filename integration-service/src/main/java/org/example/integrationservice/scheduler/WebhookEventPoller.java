package org.example.integrationservice.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.core.config.WebhookProperties;
import org.example.integrationservice.dto.BatchResult;
import org.example.integrationservice.service.worker.WebhookEventWorker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(value = "scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class WebhookEventPoller {

    private final WebhookEventWorker webhookEventWorker;
    private final WebhookProperties webhookProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.webhook.poll-interval:10000}")
    public void processWebhookEvents() {
        try {
            BatchResult result = webhookEventWorker.processBatch(clock.instant(), webhookProperties.getBatchSize());
            if (!result.isEmpty()) {
                log.info("Webhook events: {} processed, {} failed, {} skipped, {} still queued",
                        result.processed(), result.failed(), result.skipped(), result.queueDepth());
            }
        } catch (Exception e) {
            log.error("Webhook event run failed: {}", e.getMessage(), e);
        }
    }
}
