package org.example.integrationservice.dto.webhook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Envelope the ATS posts to the webhook endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WebhookPayload(
        String eventId,
        String eventType,
        String timestamp,
        Map<String, Object> data
) {
    public WebhookPayload {
        data = data == null ? Map.of() : data;
    }
}
