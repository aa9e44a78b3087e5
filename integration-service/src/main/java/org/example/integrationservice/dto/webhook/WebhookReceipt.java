package org.example.integrationservice.dto.webhook;

import java.util.UUID;

public record WebhookReceipt(
        boolean success,
        boolean duplicate,
        boolean verified,
        String message,
        UUID webhookId,
        String eventId
) {
}
