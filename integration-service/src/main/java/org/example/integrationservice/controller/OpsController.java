package org.example.integrationservice.controller;

import lombok.RequiredArgsConstructor;
import org.example.integrationservice.client.ats.AtsApiClient;
import org.example.integrationservice.client.calendar.CalendarTokenManager;
import org.example.integrationservice.dto.ops.IntegrationStatus;
import org.example.integrationservice.dto.ops.SyncJobView;
import org.example.integrationservice.service.worker.NotificationJobWorker;
import org.example.integrationservice.service.worker.SyncJobQueue;
import org.example.integrationservice.service.worker.WebhookEventWorker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/ops")
@RequiredArgsConstructor
public class OpsController {

    private final CalendarTokenManager calendarTokenManager;
    private final AtsApiClient atsApiClient;
    private final SyncJobQueue syncJobQueue;
    private final NotificationJobWorker notificationJobWorker;
    private final WebhookEventWorker webhookEventWorker;

    @GetMapping("/integrations")
    public ResponseEntity<IntegrationStatus> integrations() {
        return ResponseEntity.ok(new IntegrationStatus(
                calendarTokenManager.getTokenStatus(),
                calendarTokenManager.getMetrics(),
                atsApiClient.health(),
                atsApiClient.getMetrics(),
                syncJobQueue.counts(),
                notificationJobWorker.counts(),
                webhookEventWorker.counts()
        ));
    }

    @PostMapping("/sync-jobs/{id}/requeue")
    public ResponseEntity<SyncJobView> requeueSyncJob(@PathVariable UUID id) {
        return ResponseEntity.ok(SyncJobView.from(syncJobQueue.requeue(id)));
    }
}
