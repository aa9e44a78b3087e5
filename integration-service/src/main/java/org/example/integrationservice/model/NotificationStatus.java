package org.example.integrationservice.model;

public enum NotificationStatus {
    PENDING,
    SENDING,
    SENT,
    FAILED,
    CANCELED
}
