package org.example.integrationservice;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.integrationservice.core.config.WebhookProperties;
import org.example.integrationservice.dto.webhook.ProcessingResult;
import org.example.integrationservice.dto.webhook.WebhookPayload;
import org.example.integrationservice.dto.webhook.WebhookReceipt;
import org.example.integrationservice.model.AuditAction;
import org.example.integrationservice.model.WebhookEvent;
import org.example.integrationservice.model.WebhookStatus;
import org.example.integrationservice.repository.WebhookEventRepository;
import org.example.integrationservice.service.AuditService;
import org.example.integrationservice.service.implementation.WebhookServiceImp;
import org.example.integrationservice.service.webhook.WebhookEventHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebhookServiceUnitTest {

    private static final String SECRET = "test-webhook-secret";
    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    @Mock
    private WebhookEventRepository webhookEventRepository;

    @Mock
    private AuditService auditService;

    @Mock
    private WebhookEventHandler handler;

    private WebhookServiceImp webhookService;

    @BeforeEach
    void setUp() {
        WebhookProperties properties = new WebhookProperties();
        properties.setSecret(SECRET);
        properties.setMaxAttempts(3);

        webhookService = new WebhookServiceImp(webhookEventRepository, auditService, properties,
                List.of(handler), new ObjectMapper(), new MutableClock(NOW));
    }

    static String sign(String payload, String secret) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
    }

    private void stubSaveAssigningId() {
        when(webhookEventRepository.saveAndFlush(any(WebhookEvent.class))).thenAnswer(invocation -> {
            WebhookEvent event = invocation.getArgument(0);
            event.setId(UUID.randomUUID());
            return event;
        });
    }

    private static WebhookEvent storedEvent(String eventId, boolean verified) {
        return WebhookEvent.builder()
                .id(UUID.randomUUID())
                .provider("ats")
                .eventId(eventId)
                .payloadHash("hash")
                .eventType("application.status_changed")
                .payload(new LinkedHashMap<>(Map.of("applicationId", "app-1")))
                .verified(verified)
                .status(WebhookStatus.PROCESSING)
                .attempts(0)
                .maxAttempts(3)
                .runAfter(NOW)
                .createdAt(NOW)
                .build();
    }

    @Test
    @DisplayName("Should accept a valid HMAC-SHA256 hex signature")
    void testVerifySignature_Valid() throws Exception {
        String payload = "{\"eventType\":\"candidate.updated\"}";

        assertThat(webhookService.verifySignature(payload, sign(payload, SECRET))).isTrue();
        assertThat(webhookService.verifySignature(payload, sign(payload, SECRET).toUpperCase())).isTrue();
    }

    @Test
    @DisplayName("Should reject tampered payloads, wrong secrets and malformed signatures")
    void testVerifySignature_Invalid() throws Exception {
        String payload = "{\"eventType\":\"candidate.updated\"}";
        String signature = sign(payload, SECRET);

        assertThat(webhookService.verifySignature(payload + " ", signature)).isFalse();
        assertThat(webhookService.verifySignature(payload, sign(payload, "other-secret"))).isFalse();
        assertThat(webhookService.verifySignature(payload, "not-hex")).isFalse();
        assertThat(webhookService.verifySignature(payload, "abc")).isFalse();
        assertThat(webhookService.verifySignature(payload, null)).isFalse();
        assertThat(webhookService.verifySignature(payload, signature, "")).isFalse();
    }

    @Test
    @DisplayName("Payload hash should not depend on key order")
    void testGeneratePayloadHash_KeyOrderIndependent() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("a", 1);
        first.put("b", Map.of("y", 2, "x", 3));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("b", Map.of("x", 3, "y", 2));
        second.put("a", 1);

        assertThat(webhookService.generatePayloadHash(first))
                .hasSize(64)
                .isEqualTo(webhookService.generatePayloadHash(second));
        assertThat(webhookService.generatePayloadHash(Map.of("a", 2)))
                .isNotEqualTo(webhookService.generatePayloadHash(Map.of("a", 1)));
    }

    @Test
    @DisplayName("Should store a new verified event and audit webhook_received")
    void testReceiveWebhook_NewVerifiedEvent() throws Exception {
        String raw = "{\"eventId\":\"evt-1\",\"eventType\":\"application.status_changed\"}";
        WebhookPayload payload = new WebhookPayload("evt-1", "application.status_changed", null,
                Map.of("applicationId", "app-1"));
        when(webhookEventRepository.findByEventId("evt-1")).thenReturn(Optional.empty());
        stubSaveAssigningId();

        WebhookReceipt receipt = webhookService.receiveWebhook(payload, sign(raw, SECRET), raw);

        assertThat(receipt.success()).isTrue();
        assertThat(receipt.duplicate()).isFalse();
        assertThat(receipt.verified()).isTrue();
        assertThat(receipt.message()).isEqualTo("Event received and queued for processing");
        assertThat(receipt.eventId()).isEqualTo("evt-1");

        ArgumentCaptor<WebhookEvent> captor = ArgumentCaptor.forClass(WebhookEvent.class);
        verify(webhookEventRepository).saveAndFlush(captor.capture());
        WebhookEvent saved = captor.getValue();
        assertThat(saved.getStatus()).isEqualTo(WebhookStatus.RECEIVED);
        assertThat(saved.getProvider()).isEqualTo("ats");
        assertThat(saved.getMaxAttempts()).isEqualTo(3);
        assertThat(saved.getRunAfter()).isEqualTo(NOW);
        assertThat(saved.getPayload()).containsEntry("applicationId", "app-1");

        verify(auditService).record(eq(AuditAction.WEBHOOK_RECEIVED), anyMap());
    }

    @Test
    @DisplayName("Should store an event with a bad signature but flag it unverified")
    void testReceiveWebhook_InvalidSignatureStillStored() {
        WebhookPayload payload = new WebhookPayload("evt-2", "candidate.updated", null, Map.of());
        when(webhookEventRepository.findByEventId("evt-2")).thenReturn(Optional.empty());
        stubSaveAssigningId();

        WebhookReceipt receipt = webhookService.receiveWebhook(payload, "deadbeef", "{}");

        assertThat(receipt.success()).isTrue();
        assertThat(receipt.verified()).isFalse();
        assertThat(receipt.message()).isEqualTo("Event received (signature invalid)");
    }

    @Test
    @DisplayName("Should dedupe by eventId without inserting")
    void testReceiveWebhook_DuplicateEventId() {
        WebhookEvent existing = storedEvent("evt-1", true);
        when(webhookEventRepository.findByEventId("evt-1")).thenReturn(Optional.of(existing));

        WebhookReceipt receipt = webhookService.receiveWebhook(
                new WebhookPayload("evt-1", "application.status_changed", null, Map.of()), null, "{}");

        assertThat(receipt.duplicate()).isTrue();
        assertThat(receipt.webhookId()).isEqualTo(existing.getId());
        assertThat(receipt.message()).isEqualTo("Event already received (eventId duplicate)");
        verify(webhookEventRepository, never()).saveAndFlush(any());
        verify(auditService).record(eq(AuditAction.WEBHOOK_DEDUPED), anyMap());
    }

    @Test
    @DisplayName("Should dedupe by payload hash when the sender gives no eventId")
    void testReceiveWebhook_DuplicatePayloadHash() {
        WebhookEvent existing = storedEvent(null, true);
        when(webhookEventRepository.findFirstByPayloadHashAndEventIdIsNullOrderByCreatedAtAsc(anyString()))
                .thenReturn(Optional.of(existing));

        WebhookReceipt receipt = webhookService.receiveWebhook(
                new WebhookPayload(null, "candidate.updated", null, Map.of("k", "v")), null, "{}");

        assertThat(receipt.duplicate()).isTrue();
        assertThat(receipt.message()).isEqualTo("Event already received (payload hash duplicate)");
        verify(webhookEventRepository, never()).findByEventId(any());
    }

    @Test
    @DisplayName("Should report a duplicate when a concurrent insert wins the unique index")
    void testReceiveWebhook_ConcurrentInsert() {
        WebhookEvent winner = storedEvent("evt-3", true);
        when(webhookEventRepository.findByEventId("evt-3"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(winner));
        when(webhookEventRepository.saveAndFlush(any(WebhookEvent.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        WebhookReceipt receipt = webhookService.receiveWebhook(
                new WebhookPayload("evt-3", "candidate.updated", null, Map.of()), null, "{}");

        assertThat(receipt.duplicate()).isTrue();
        assertThat(receipt.webhookId()).isEqualTo(winner.getId());
    }

    @Test
    @DisplayName("Should refuse to process an unverified event")
    void testProcessWebhookEvent_Unverified() {
        ProcessingResult result = webhookService.processWebhookEvent(storedEvent("evt-1", false));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Webhook signature not verified");
        verifyNoInteractions(handler, webhookEventRepository);
    }

    @Test
    @DisplayName("Should dispatch to the handler and mark the event processed")
    void testProcessWebhookEvent_Success() {
        WebhookEvent event = storedEvent("evt-1", true);
        when(handler.supports("application.status_changed")).thenReturn(true);

        ProcessingResult result = webhookService.processWebhookEvent(event);

        assertThat(result.success()).isTrue();
        verify(handler).handle(event);
        assertThat(event.getStatus()).isEqualTo(WebhookStatus.PROCESSED);
        assertThat(event.getProcessedAt()).isEqualTo(NOW);
        verify(webhookEventRepository).save(event);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> audit = ArgumentCaptor.forClass(Map.class);
        verify(auditService).record(eq(AuditAction.WEBHOOK_PROCESSED), audit.capture());
        assertThat(audit.getValue()).containsEntry("applicationId", "app-1");
    }

    @Test
    @DisplayName("Should mark events without a handler as processed")
    void testProcessWebhookEvent_UnknownType() {
        WebhookEvent event = storedEvent("evt-1", true);
        when(handler.supports(anyString())).thenReturn(false);

        assertThat(webhookService.processWebhookEvent(event).success()).isTrue();
        assertThat(event.getStatus()).isEqualTo(WebhookStatus.PROCESSED);
        verify(handler, never()).handle(any());
    }

    @Test
    @DisplayName("Should schedule a retry at 2^attempts minutes after a handler failure")
    void testProcessWebhookEvent_FailureSchedulesRetry() {
        WebhookEvent event = storedEvent("evt-1", true);
        event.setAttempts(1);
        when(handler.supports(anyString())).thenReturn(true);
        doThrow(new IllegalStateException("downstream unavailable")).when(handler).handle(event);

        ProcessingResult result = webhookService.processWebhookEvent(event);

        assertThat(result.success()).isFalse();
        assertThat(event.getAttempts()).isEqualTo(2);
        assertThat(event.getStatus()).isEqualTo(WebhookStatus.RECEIVED);
        assertThat(event.getRunAfter()).isEqualTo(NOW.plusSeconds(4 * 60));
        assertThat(event.getLastError()).isEqualTo("downstream unavailable");
        verify(auditService, never()).record(eq(AuditAction.WEBHOOK_FAILED), anyMap());
    }

    @Test
    @DisplayName("Should fail permanently once max attempts is reached")
    void testProcessWebhookEvent_FailurePermanent() {
        WebhookEvent event = storedEvent("evt-1", true);
        event.setAttempts(2);
        when(handler.supports(anyString())).thenReturn(true);
        doThrow(new IllegalStateException("x".repeat(800))).when(handler).handle(event);

        webhookService.processWebhookEvent(event);

        assertThat(event.getStatus()).isEqualTo(WebhookStatus.FAILED);
        assertThat(event.getAttempts()).isEqualTo(3);
        assertThat(event.getLastError()).hasSize(500);
        verify(auditService).record(eq(AuditAction.WEBHOOK_FAILED), anyMap());
    }
}
