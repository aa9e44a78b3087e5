package org.example.integrationservice.service.webhook;

import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.model.WebhookEvent;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

@Component
@Slf4j
public class AtsWebhookEventHandler implements WebhookEventHandler {

    public static final String APPLICATION_STATUS_CHANGED = "application.status_changed";
    public static final String CANDIDATE_UPDATED = "candidate.updated";
    public static final String REQUISITION_UPDATED = "requisition.updated";

    private static final Set<String> SUPPORTED = Set.of(APPLICATION_STATUS_CHANGED, CANDIDATE_UPDATED, REQUISITION_UPDATED);

    @Override
    public boolean supports(String eventType) {
        return SUPPORTED.contains(eventType);
    }

    @Override
    public void handle(WebhookEvent event) {
        Map<String, Object> data = event.getPayload();

        switch (event.getEventType()) {
            case APPLICATION_STATUS_CHANGED -> log.info("Application {} changed status to {}",
                    data.get("applicationId"), data.get("status"));
            case CANDIDATE_UPDATED -> log.info("Candidate on application {} updated", data.get("applicationId"));
            case REQUISITION_UPDATED -> log.info("Requisition {} updated", data.get("requisitionId"));
            default -> throw new IllegalArgumentException("Unsupported event type: " + event.getEventType());
        }
    }
}
