package org.example.integrationservice.service.implementation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.core.config.WebhookProperties;
import org.example.integrationservice.dto.webhook.ProcessingResult;
import org.example.integrationservice.dto.webhook.WebhookPayload;
import org.example.integrationservice.dto.webhook.WebhookReceipt;
import org.example.integrationservice.model.AuditAction;
import org.example.integrationservice.model.WebhookEvent;
import org.example.integrationservice.model.WebhookStatus;
import org.example.integrationservice.repository.WebhookEventRepository;
import org.example.integrationservice.service.AuditService;
import org.example.integrationservice.service.WebhookService;
import org.example.integrationservice.service.webhook.WebhookEventHandler;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@Service
@Slf4j
public class WebhookServiceImp implements WebhookService {

    public static final String PROVIDER = "ats";
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int MAX_ERROR_LENGTH = 500;

    private final WebhookEventRepository webhookEventRepository;
    private final AuditService auditService;
    private final WebhookProperties properties;
    private final List<WebhookEventHandler> handlers;
    private final Clock clock;
    private final ObjectMapper canonicalMapper;

    public WebhookServiceImp(
            WebhookEventRepository webhookEventRepository,
            AuditService auditService,
            WebhookProperties properties,
            List<WebhookEventHandler> handlers,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.webhookEventRepository = webhookEventRepository;
        this.auditService = auditService;
        this.properties = properties;
        this.handlers = handlers;
        this.clock = clock;
        this.canonicalMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    @Override
    public boolean verifySignature(String payload, String signature, String secret) {
        if (!StringUtils.hasText(signature) || !StringUtils.hasText(secret) || payload == null) {
            return false;
        }
        try {
            byte[] provided = HexFormat.of().parseHex(signature.trim());
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            byte[] expected = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            return MessageDigest.isEqual(expected, provided);
        } catch (IllegalArgumentException e) {
            log.debug("Webhook signature is not valid hex");
            return false;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }

    @Override
    public boolean verifySignature(String payload, String signature) {
        return verifySignature(payload, signature, properties.getSecret());
    }

    @Override
    public String generatePayloadHash(Map<String, Object> data) {
        try {
            byte[] canonical = canonicalMapper.writeValueAsBytes(data);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Webhook data cannot be serialized", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public WebhookReceipt receiveWebhook(WebhookPayload payload, String signature, String rawPayload) {
        boolean verified = verifySignature(rawPayload, signature);
        boolean hasEventId = StringUtils.hasText(payload.eventId());
        String payloadHash = generatePayloadHash(hashInput(payload));

        Optional<WebhookEvent> existing = hasEventId
                ? webhookEventRepository.findByEventId(payload.eventId())
                : webhookEventRepository.findFirstByPayloadHashAndEventIdIsNullOrderByCreatedAtAsc(payloadHash);
        if (existing.isPresent()) {
            return deduplicated(existing.get(), hasEventId, verified);
        }

        Instant now = clock.instant();
        WebhookEvent event = WebhookEvent.builder()
                .provider(PROVIDER)
                .eventId(hasEventId ? payload.eventId() : null)
                .payloadHash(payloadHash)
                .eventType(payload.eventType())
                .payload(new LinkedHashMap<>(payload.data()))
                .signature(signature)
                .verified(verified)
                .status(WebhookStatus.RECEIVED)
                .attempts(0)
                .maxAttempts(properties.getMaxAttempts())
                .runAfter(now)
                .createdAt(now)
                .updatedAt(now)
                .build();

        try {
            event = webhookEventRepository.saveAndFlush(event);
        } catch (DataIntegrityViolationException e) {
            // a concurrent delivery of the same eventId won the insert
            WebhookEvent winner = hasEventId
                    ? webhookEventRepository.findByEventId(payload.eventId()).orElseThrow(() -> e)
                    : webhookEventRepository.findFirstByPayloadHashAndEventIdIsNullOrderByCreatedAtAsc(payloadHash).orElseThrow(() -> e);
            return deduplicated(winner, hasEventId, verified);
        }

        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("webhookEventId", event.getId().toString());
        audit.put("externalEventId", event.getEventId());
        audit.put("eventType", event.getEventType());
        audit.put("provider", event.getProvider());
        audit.put("verified", event.isVerified());
        audit.put("payloadHash", event.getPayloadHash());
        auditService.record(AuditAction.WEBHOOK_RECEIVED, audit);

        if (verified) {
            log.info("Webhook {} ({}) stored for processing", event.getId(), event.getEventType());
        } else {
            log.warn("Webhook {} ({}) stored with an invalid signature", event.getId(), event.getEventType());
        }

        return new WebhookReceipt(
                true,
                false,
                verified,
                verified ? "Event received and queued for processing" : "Event received (signature invalid)",
                event.getId(),
                event.getEventId()
        );
    }

    @Override
    public ProcessingResult processWebhookEvent(WebhookEvent event) {
        if (!event.isVerified()) {
            return ProcessingResult.failure("Webhook signature not verified");
        }

        try {
            handlers.stream()
                    .filter(handler -> handler.supports(event.getEventType()))
                    .findFirst()
                    .ifPresentOrElse(
                            handler -> handler.handle(event),
                            () -> log.info("No handler for webhook event type {}, marking processed", event.getEventType()));

            Instant now = clock.instant();
            event.setStatus(WebhookStatus.PROCESSED);
            event.setProcessedAt(now);
            event.setUpdatedAt(now);
            webhookEventRepository.save(event);

            auditService.record(AuditAction.WEBHOOK_PROCESSED, normalizedFields(event));
            return ProcessingResult.ok();

        } catch (RuntimeException e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            handleFailure(event, error);
            return ProcessingResult.failure(error);
        }
    }

    private void handleFailure(WebhookEvent event, String error) {
        Instant now = clock.instant();
        int attempts = event.getAttempts() + 1;
        event.setAttempts(attempts);
        event.setLastError(truncate(error));
        event.setUpdatedAt(now);

        if (attempts >= event.getMaxAttempts()) {
            event.setStatus(WebhookStatus.FAILED);
            webhookEventRepository.save(event);

            Map<String, Object> audit = new LinkedHashMap<>();
            audit.put("webhookEventId", event.getId().toString());
            audit.put("eventType", event.getEventType());
            audit.put("error", truncate(error));
            audit.put("attempts", attempts);
            auditService.record(AuditAction.WEBHOOK_FAILED, audit);

            log.error("Webhook {} failed permanently after {} attempts: {}", event.getId(), attempts, error);
        } else {
            event.setStatus(WebhookStatus.RECEIVED);
            event.setRunAfter(now.plus(Duration.ofMinutes(1L << attempts)));
            webhookEventRepository.save(event);

            log.warn("Webhook {} failed (attempt {}), retrying at {}: {}", event.getId(), attempts, event.getRunAfter(), error);
        }
    }

    private WebhookReceipt deduplicated(WebhookEvent existing, boolean byEventId, boolean verified) {
        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("webhookEventId", existing.getId().toString());
        audit.put("externalEventId", existing.getEventId());
        audit.put("eventType", existing.getEventType());
        audit.put("provider", existing.getProvider());
        auditService.record(AuditAction.WEBHOOK_DEDUPED, audit);

        log.info("Duplicate webhook delivery for {} ignored", existing.getId());

        return new WebhookReceipt(
                true,
                true,
                verified,
                byEventId ? "Event already received (eventId duplicate)" : "Event already received (payload hash duplicate)",
                existing.getId(),
                existing.getEventId()
        );
    }

    private static Map<String, Object> hashInput(WebhookPayload payload) {
        Map<String, Object> input = new TreeMap<>();
        input.put("eventType", payload.eventType());
        input.put("data", payload.data());
        return input;
    }

    private static Map<String, Object> normalizedFields(WebhookEvent event) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("webhookEventId", event.getId().toString());
        fields.put("eventType", event.getEventType());

        Map<String, Object> data = event.getPayload();
        if (data != null) {
            for (String key : List.of("applicationId", "candidateEmail", "requisitionId")) {
                if (data.get(key) != null) {
                    fields.put(key, data.get(key));
                }
            }
        }
        return fields;
    }

    private static String truncate(String value) {
        return value.length() > MAX_ERROR_LENGTH ? value.substring(0, MAX_ERROR_LENGTH) : value;
    }
}
