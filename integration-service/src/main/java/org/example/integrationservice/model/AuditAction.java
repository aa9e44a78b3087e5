package org.example.integrationservice.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

@Getter
@RequiredArgsConstructor
public enum AuditAction {
    WEBHOOK_RECEIVED("webhook_received"),
    WEBHOOK_DEDUPED("webhook_deduped"),
    WEBHOOK_PROCESSED("webhook_processed"),
    WEBHOOK_FAILED("webhook_failed"),
    ATS_NOTE_ATTEMPT("ats_note_attempt"),
    ATS_NOTE_SUCCESS("ats_note_success"),
    ATS_NOTE_FAILED("ats_note_failed"),
    SYNC_JOB_CREATED("sync_job_created"),
    SYNC_JOB_SUCCESS("sync_job_success"),
    SYNC_JOB_FAILED("sync_job_failed"),
    SYNC_JOB_REQUEUED("sync_job_requeued");

    private final String value;

    public static AuditAction fromValue(String value) {
        return Arrays.stream(values())
                .filter(a -> a.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown audit action: " + value));
    }
}
