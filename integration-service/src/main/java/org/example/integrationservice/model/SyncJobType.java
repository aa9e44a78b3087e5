package org.example.integrationservice.model;

public enum SyncJobType {
    ATS_NOTE
}
