package org.example.integrationservice.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.dto.webhook.WebhookAck;
import org.example.integrationservice.dto.webhook.WebhookPayload;
import org.example.integrationservice.dto.webhook.WebhookReceipt;
import org.example.integrationservice.service.WebhookService;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

/**
 * Inbound ATS webhooks. The raw body is kept as received because the signature covers the exact bytes.
 */
@Slf4j
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookController {

    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";

    private final WebhookService webhookService;
    private final ObjectMapper objectMapper;

    @PostMapping("/ats")
    public ResponseEntity<WebhookAck> receiveAtsWebhook(
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestBody(required = false) String rawBody
    ) {
        if (!StringUtils.hasText(rawBody)) {
            return ResponseEntity.ok(WebhookAck.rejected("Empty payload"));
        }

        WebhookPayload payload;
        try {
            payload = objectMapper.readValue(rawBody, WebhookPayload.class);
        } catch (JsonProcessingException e) {
            log.warn("Rejected webhook with malformed JSON: {}", e.getOriginalMessage());
            return ResponseEntity.ok(WebhookAck.rejected("Invalid JSON payload"));
        }

        if (payload == null || !StringUtils.hasText(payload.eventType())) {
            return ResponseEntity.ok(WebhookAck.rejected("Missing required field: eventType"));
        }

        try {
            WebhookReceipt receipt = webhookService.receiveWebhook(payload, signature == null ? "" : signature, rawBody);
            return ResponseEntity.ok(WebhookAck.from(receipt));
        } catch (RuntimeException e) {
            log.error("Failed to store webhook {}: {}", payload.eventType(), e.getMessage(), e);
            return ResponseEntity.ok(WebhookAck.rejected("Webhook could not be stored"));
        }
    }
}
