package org.example.integrationservice.dto.webhook;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Body returned to the ATS. The endpoint answers 200 even for rejected deliveries so the sender does not retry them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookAck(
        boolean received,
        UUID webhookId,
        String eventId,
        @JsonProperty("isDuplicate") boolean duplicate,
        boolean verified,
        String message
) {
    public static WebhookAck from(WebhookReceipt receipt) {
        return new WebhookAck(receipt.success(), receipt.webhookId(), receipt.eventId(),
                receipt.duplicate(), receipt.verified(), receipt.message());
    }

    public static WebhookAck rejected(String message) {
        return new WebhookAck(false, null, null, false, false, message);
    }
}
