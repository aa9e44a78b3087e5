package org.example.integrationservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "webhook_events", indexes = {
        @Index(name = "idx_webhook_event_id", columnList = "event_id", unique = true),
        @Index(name = "idx_webhook_payload_hash", columnList = "payload_hash"),
        @Index(name = "idx_webhook_status_run_after", columnList = "status, run_after")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WebhookEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String provider;

    //The sender's id, absent for some senders. Dedup falls back to payloadHash then
    @Column(name = "event_id")
    private String eventId;

    @Column(name = "payload_hash", nullable = false, length = 64)
    private String payloadHash;

    @Column(nullable = false)
    private String eventType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private Map<String, Object> payload;

    private String signature;

    @Column(nullable = false)
    private boolean verified;

    @Column(nullable = false)
    @Enumerated(EnumType.STRING)
    private WebhookStatus status;

    @Column(nullable = false)
    private int attempts;

    @Column(nullable = false)
    private int maxAttempts;

    @Column(length = 1000)
    private String lastError;

    @Column(name = "run_after", nullable = false)
    private Instant runAfter;

    private Instant processedAt;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;

}
