package org.example.integrationservice.service.implementation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.core.config.SyncProperties;
import org.example.integrationservice.dto.NotificationRequest;
import org.example.integrationservice.model.NotificationEntityType;
import org.example.integrationservice.model.NotificationJob;
import org.example.integrationservice.model.NotificationStatus;
import org.example.integrationservice.model.NotificationType;
import org.example.integrationservice.repository.NotificationJobRepository;
import org.example.integrationservice.service.NotificationService;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationServiceImp implements NotificationService {

    private static final DateTimeFormatter HOUR_BUCKET =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH").withZone(ZoneOffset.UTC);

    private final NotificationJobRepository notificationJobRepository;
    private final SyncProperties syncProperties;
    private final Clock clock;

    @Override
    public NotificationJob enqueue(NotificationRequest request) {
        String key = idempotencyKey(request.type(), request.entityType(), request.entityId(), request.discriminator());

        Optional<NotificationJob> existing = notificationJobRepository.findByIdempotencyKey(key);
        if (existing.isPresent()) {
            log.debug("Notification {} already queued as {}", key, existing.get().getId());
            return existing.get();
        }

        Instant now = clock.instant();
        NotificationJob job = NotificationJob.builder()
                .type(request.type())
                .entityType(request.entityType())
                .entityId(request.entityId())
                .idempotencyKey(key)
                .toEmail(request.toEmail())
                .payload(copyOf(request.payload()))
                .status(NotificationStatus.PENDING)
                .attempts(0)
                .maxAttempts(syncProperties.getNotificationMaxAttempts())
                .runAfter(request.runAfter() != null ? request.runAfter() : now)
                .createdAt(now)
                .updatedAt(now)
                .build();

        try {
            NotificationJob saved = notificationJobRepository.saveAndFlush(job);
            log.info("Notification {} queued for {} {}", request.type(), request.entityType(), request.entityId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            return notificationJobRepository.findByIdempotencyKey(key).orElseThrow(() -> e);
        }
    }

    @Override
    public int cancelPending(NotificationEntityType entityType, String entityId) {
        int cancelled = notificationJobRepository.cancelPending(entityType, entityId, clock.instant());
        if (cancelled > 0) {
            log.info("Cancelled {} pending notifications for {} {}", cancelled, entityType, entityId);
        }
        return cancelled;
    }

    @Override
    public int cancelPendingReminders(String bookingId) {
        return notificationJobRepository.cancelPendingOfTypes(NotificationEntityType.BOOKING, bookingId,
                List.of(NotificationType.REMINDER_24H, NotificationType.REMINDER_2H), clock.instant());
    }

    /**
     * {@code {type}:{entityType}:{entityId}[:{discriminator}]}, lower case.
     */
    public static String idempotencyKey(NotificationType type, NotificationEntityType entityType,
                                        String entityId, String discriminator) {
        String key = type.name().toLowerCase(Locale.ROOT) + ":" + entityType.name().toLowerCase(Locale.ROOT) + ":" + entityId;
        return StringUtils.hasText(discriminator) ? key + ":" + discriminator : key;
    }

    /**
     * Hour-granular discriminator, so one reminder per booking per target hour.
     */
    public static String timeBucket(Instant instant) {
        return HOUR_BUCKET.format(instant);
    }

    private static Map<String, Object> copyOf(Map<String, Object> payload) {
        return payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
    }
}
