package org.example.integrationservice.service.worker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.dto.BatchResult;
import org.example.integrationservice.dto.QueueCounts;
import org.example.integrationservice.dto.webhook.ProcessingResult;
import org.example.integrationservice.model.WebhookEvent;
import org.example.integrationservice.model.WebhookStatus;
import org.example.integrationservice.repository.WebhookEventRepository;
import org.example.integrationservice.service.WebhookService;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Drains verified webhook events that are due. Retry scheduling on failure is owned by {@link WebhookService}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WebhookEventWorker {

    private final WebhookEventRepository webhookEventRepository;
    private final WebhookService webhookService;
    private final Clock clock;

    public BatchResult processBatch(Instant now, int limit) {
        List<WebhookEvent> events = webhookEventRepository.findProcessableEvents(now, limit);

        int processed = 0;
        int failed = 0;
        int skipped = 0;
        List<BatchResult.BatchError> errors = new ArrayList<>();

        for (WebhookEvent event : events) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Webhook worker interrupted, leaving remaining events for the next run");
                break;
            }

            Instant claimedAt = clock.instant();
            if (webhookEventRepository.transition(event.getId(), WebhookStatus.RECEIVED, WebhookStatus.PROCESSING, claimedAt) == 0) {
                skipped++;
                continue;
            }
            event.setStatus(WebhookStatus.PROCESSING);
            event.setUpdatedAt(claimedAt);

            ProcessingResult result = webhookService.processWebhookEvent(event);
            if (result.success()) {
                processed++;
            } else {
                failed++;
                errors.add(new BatchResult.BatchError(event.getId().toString(), result.error()));
            }
        }

        return new BatchResult(processed, failed, skipped, webhookEventRepository.countByStatus(WebhookStatus.RECEIVED), errors);
    }

    public QueueCounts counts() {
        return new QueueCounts(
                webhookEventRepository.countByStatus(WebhookStatus.RECEIVED),
                webhookEventRepository.countByStatus(WebhookStatus.PROCESSING),
                webhookEventRepository.countByStatus(WebhookStatus.PROCESSED),
                webhookEventRepository.countByStatus(WebhookStatus.FAILED)
        );
    }

    public int releaseStale(Duration leaseTimeout) {
        Instant now = clock.instant();
        int released = webhookEventRepository.releaseStale(WebhookStatus.PROCESSING, WebhookStatus.RECEIVED, now.minus(leaseTimeout), now);
        if (released > 0) {
            log.warn("Released {} webhook events stuck in processing for more than {}", released, leaseTimeout);
        }
        return released;
    }
}
