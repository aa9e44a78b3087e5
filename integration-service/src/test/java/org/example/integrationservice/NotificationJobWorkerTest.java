package org.example.integrationservice;

import org.example.integrationservice.dto.BatchResult;
import org.example.integrationservice.model.NotificationEntityType;
import org.example.integrationservice.model.NotificationJob;
import org.example.integrationservice.model.NotificationStatus;
import org.example.integrationservice.model.NotificationType;
import org.example.integrationservice.repository.NotificationJobRepository;
import org.example.integrationservice.service.NotificationSender;
import org.example.integrationservice.service.worker.NotificationJobWorker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationJobWorkerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    @Mock
    private NotificationJobRepository notificationJobRepository;

    @Mock
    private ObjectProvider<NotificationSender> senderProvider;

    @Mock
    private NotificationSender sender;

    private NotificationJobWorker notificationJobWorker;

    @BeforeEach
    void setUp() {
        notificationJobWorker = new NotificationJobWorker(notificationJobRepository, senderProvider, new MutableClock(NOW));
    }

    private static NotificationJob pending(int attempts) {
        return NotificationJob.builder()
                .id(UUID.randomUUID())
                .type(NotificationType.BOOKING_CONFIRMATION)
                .entityType(NotificationEntityType.BOOKING)
                .entityId("book-1")
                .idempotencyKey("booking_confirmation:booking:book-1")
                .toEmail("candidate@example.com")
                .payload(Map.of())
                .status(NotificationStatus.PENDING)
                .attempts(attempts)
                .maxAttempts(5)
                .runAfter(NOW)
                .createdAt(NOW)
                .build();
    }

    @Test
    @DisplayName("Should leave the queue alone when no sender is configured")
    void testProcessBatch_NoSender() {
        when(senderProvider.getIfAvailable()).thenReturn(null);
        when(notificationJobRepository.countByStatus(NotificationStatus.PENDING)).thenReturn(3L);

        BatchResult result = notificationJobWorker.processBatch(NOW, 10);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.queueDepth()).isEqualTo(3);
        verify(notificationJobRepository, never()).findPendingNotifications(any(), anyInt());
    }

    @Test
    @DisplayName("Should mark a delivered notification as sent")
    void testProcessBatch_Sent() {
        NotificationJob job = pending(0);
        job.setLastError("previous failure");
        when(senderProvider.getIfAvailable()).thenReturn(sender);
        when(notificationJobRepository.findPendingNotifications(NOW, 10)).thenReturn(List.of(job));
        when(notificationJobRepository.transition(job.getId(), NotificationStatus.PENDING, NotificationStatus.SENDING, NOW))
                .thenReturn(1);
        when(sender.send(job)).thenReturn("msg-1");

        BatchResult result = notificationJobWorker.processBatch(NOW, 10);

        assertThat(result.processed()).isEqualTo(1);
        assertThat(job.getStatus()).isEqualTo(NotificationStatus.SENT);
        assertThat(job.getAttempts()).isEqualTo(1);
        assertThat(job.getSentAt()).isEqualTo(NOW);
        assertThat(job.getLastError()).isNull();
        verify(notificationJobRepository).save(job);
    }

    @Test
    @DisplayName("Should reschedule a failed delivery and fail it once attempts run out")
    void testProcessBatch_Failures() {
        NotificationJob retryable = pending(0);
        NotificationJob exhausted = pending(4);
        when(senderProvider.getIfAvailable()).thenReturn(sender);
        when(notificationJobRepository.findPendingNotifications(NOW, 10)).thenReturn(List.of(retryable, exhausted));
        when(notificationJobRepository.transition(any(), any(), any(), any())).thenReturn(1);
        when(sender.send(any())).thenThrow(new IllegalStateException("smtp down"));

        BatchResult result = notificationJobWorker.processBatch(NOW, 10);

        assertThat(result.failed()).isEqualTo(2);
        assertThat(retryable.getStatus()).isEqualTo(NotificationStatus.PENDING);
        assertThat(retryable.getRunAfter()).isEqualTo(NOW.plus(Duration.ofMinutes(5)));
        assertThat(exhausted.getStatus()).isEqualTo(NotificationStatus.FAILED);
        assertThat(exhausted.getLastError()).isEqualTo("smtp down");
    }

    @Test
    @DisplayName("Should skip notifications claimed by another worker")
    void testProcessBatch_LostClaim() {
        NotificationJob job = pending(0);
        when(senderProvider.getIfAvailable()).thenReturn(sender);
        when(notificationJobRepository.findPendingNotifications(NOW, 10)).thenReturn(List.of(job));
        when(notificationJobRepository.transition(any(), any(), any(), any())).thenReturn(0);

        BatchResult result = notificationJobWorker.processBatch(NOW, 10);

        assertThat(result.skipped()).isEqualTo(1);
        verifyNoInteractions(sender);
    }
}
