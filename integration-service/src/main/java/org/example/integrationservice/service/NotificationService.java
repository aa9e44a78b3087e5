package org.example.integrationservice.service;

import org.example.integrationservice.dto.NotificationRequest;
import org.example.integrationservice.model.NotificationEntityType;
import org.example.integrationservice.model.NotificationJob;

public interface NotificationService {

    /**
     * Queues a notification once per idempotency key; a repeated request returns the job created first.
     */
    NotificationJob enqueue(NotificationRequest request);

    int cancelPending(NotificationEntityType entityType, String entityId);

    /**
     * Cancels the 24h and 2h reminders of a booking that was cancelled or moved.
     */
    int cancelPendingReminders(String bookingId);
}
