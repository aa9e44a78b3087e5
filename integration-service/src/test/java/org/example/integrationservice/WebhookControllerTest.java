package org.example.integrationservice;

import org.example.integrationservice.controller.WebhookController;
import org.example.integrationservice.dto.webhook.WebhookPayload;
import org.example.integrationservice.dto.webhook.WebhookReceipt;
import org.example.integrationservice.service.WebhookService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = WebhookController.class)
class WebhookControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WebhookService webhookService;

    @Test
    @DisplayName("Should hand the raw body and signature to the service and echo the receipt")
    void testReceive_Accepted() throws Exception {
        UUID webhookId = UUID.randomUUID();
        String body = "{\"eventId\":\"evt-1\",\"eventType\":\"candidate.updated\",\"data\":{\"applicationId\":\"app-1\"}}";
        when(webhookService.receiveWebhook(any(), eq("abc123"), eq(body)))
                .thenReturn(new WebhookReceipt(true, false, true, "Event received and queued for processing", webhookId, "evt-1"));

        mockMvc.perform(post("/api/webhooks/ats")
                        .header("X-Webhook-Signature", "abc123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true))
                .andExpect(jsonPath("$.webhookId").value(webhookId.toString()))
                .andExpect(jsonPath("$.eventId").value("evt-1"))
                .andExpect(jsonPath("$.isDuplicate").value(false))
                .andExpect(jsonPath("$.verified").value(true));

        ArgumentCaptor<WebhookPayload> payload = ArgumentCaptor.forClass(WebhookPayload.class);
        verify(webhookService).receiveWebhook(payload.capture(), anyString(), anyString());
        assertThat(payload.getValue().data()).containsEntry("applicationId", "app-1");
    }

    @Test
    @DisplayName("Should answer 200 with received=false for an empty body")
    void testReceive_EmptyBody() throws Exception {
        mockMvc.perform(post("/api/webhooks/ats").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(false))
                .andExpect(jsonPath("$.message").value("Empty payload"));

        verifyNoInteractions(webhookService);
    }

    @Test
    @DisplayName("Should answer 200 with received=false for malformed JSON")
    void testReceive_InvalidJson() throws Exception {
        mockMvc.perform(post("/api/webhooks/ats")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(false))
                .andExpect(jsonPath("$.message").value("Invalid JSON payload"));
    }

    @Test
    @DisplayName("Should reject a payload without eventType")
    void testReceive_MissingEventType() throws Exception {
        mockMvc.perform(post("/api/webhooks/ats")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eventId\":\"evt-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(false))
                .andExpect(jsonPath("$.message").value("Missing required field: eventType"));
    }

    @Test
    @DisplayName("Should still answer 200 when storing fails")
    void testReceive_StorageFailure() throws Exception {
        when(webhookService.receiveWebhook(any(), anyString(), anyString()))
                .thenThrow(new IllegalStateException("database down"));

        mockMvc.perform(post("/api/webhooks/ats")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eventType\":\"candidate.updated\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(false))
                .andExpect(jsonPath("$.message").value("Webhook could not be stored"));
    }
}
