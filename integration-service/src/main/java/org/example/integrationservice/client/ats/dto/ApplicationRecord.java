package org.example.integrationservice.client.ats.dto;

/**
 * Normalized view of an ATS application, independent of the response shape the tenant returns.
 */
public record ApplicationRecord(
        String id,
        String candidateName,
        String candidateEmail,
        String requisitionId,
        String requisitionTitle,
        String status
) {
}
