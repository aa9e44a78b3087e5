package org.example.integrationservice.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.core.config.SyncProperties;
import org.example.integrationservice.dto.BatchResult;
import org.example.integrationservice.service.worker.SyncJobWorker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(value = "scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SyncJobPoller {

    private final SyncJobWorker syncJobWorker;
    private final SyncProperties syncProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.sync.poll-interval:60000}")
    public void processSyncJobs() {
        Instant now = clock.instant();
        try {
            BatchResult result = syncJobWorker.processBatch(now, syncProperties.getBatchSize(), now.plus(syncProperties.getBatchTimeout()));
            if (!result.isEmpty()) {
                log.info("Sync jobs: {} completed, {} failed, {} skipped, {} still pending",
                        result.processed(), result.failed(), result.skipped(), result.queueDepth());
            }
        } catch (Exception e) {
            log.error("Sync job run failed: {}", e.getMessage(), e);
        }
    }
}
