package org.example.integrationservice.model;

public enum SyncJobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
