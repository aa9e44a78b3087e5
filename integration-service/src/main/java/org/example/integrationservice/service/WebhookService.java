package org.example.integrationservice.service;

import org.example.integrationservice.dto.webhook.ProcessingResult;
import org.example.integrationservice.dto.webhook.WebhookPayload;
import org.example.integrationservice.dto.webhook.WebhookReceipt;
import org.example.integrationservice.model.WebhookEvent;

import java.util.Map;

public interface WebhookService {

    boolean verifySignature(String payload, String signature, String secret);

    /**
     * Verifies against the configured webhook secret.
     */
    boolean verifySignature(String payload, String signature);

    String generatePayloadHash(Map<String, Object> data);

    /**
     * Stores the event for asynchronous processing unless it was already received.
     * Never rejects on a bad signature: the event is kept with {@code verified=false}.
     */
    WebhookReceipt receiveWebhook(WebhookPayload payload, String signature, String rawPayload);

    ProcessingResult processWebhookEvent(WebhookEvent event);
}
