package org.example.integrationservice.service;

import org.example.integrationservice.model.AuditAction;
import org.example.integrationservice.model.AuditLog;

import java.util.Map;

public interface AuditService {

    /**
     * Appends a system-authored entry.
     *
     * @param requestId scheduling request the entry relates to, may be null
     * @param bookingId booking the entry relates to, may be null
     */
    AuditLog record(AuditAction action, String requestId, String bookingId, Map<String, Object> payload);

    default AuditLog record(AuditAction action, Map<String, Object> payload) {
        return record(action, null, null, payload);
    }
}
