package org.example.integrationservice.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.example.integrationservice.model.NotificationEntityType;
import org.example.integrationservice.model.NotificationType;

import java.time.Instant;
import java.util.Map;

/**
 * @param runAfter      earliest send time, null means now
 * @param discriminator distinguishes intentional repeats of the same notification, for example a reminder time bucket
 */
public record NotificationRequest(
        @NotNull NotificationType type,
        @NotNull NotificationEntityType entityType,
        @NotBlank String entityId,
        @NotBlank @Email String toEmail,
        Map<String, Object> payload,
        Instant runAfter,
        String discriminator
) {
}
