package org.example.integrationservice.model;

public enum WebhookStatus {
    RECEIVED,
    PROCESSING,
    PROCESSED,
    FAILED
}
