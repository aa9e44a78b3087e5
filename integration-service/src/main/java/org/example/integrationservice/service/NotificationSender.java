package org.example.integrationservice.service;

import org.example.integrationservice.model.NotificationJob;

/**
 * Delivery channel for queued notifications (email rendering and transport live behind it).
 * Any exception counts as a failed attempt.
 */
public interface NotificationSender {

    /**
     * @return provider message id, may be null
     */
    String send(NotificationJob job);
}
