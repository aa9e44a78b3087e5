package org.example.integrationservice.service.webhook;

import org.example.integrationservice.model.WebhookEvent;

/**
 * Applies a verified inbound event. Throwing marks the attempt as failed and schedules a retry.
 */
public interface WebhookEventHandler {

    boolean supports(String eventType);

    void handle(WebhookEvent event);
}
