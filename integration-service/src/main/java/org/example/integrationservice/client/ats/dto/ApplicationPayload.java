package org.example.integrationservice.client.ats.dto;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.integrationservice.client.ats.exception.AtsResponseFormatException;

/**
 * The two application shapes ATS tenants are known to return.
 * Anything else is rejected instead of being guessed at.
 */
public sealed interface ApplicationPayload permits ApplicationPayload.Flat, ApplicationPayload.Nested {

    String id();

    String candidateName();

    String candidateEmail();

    String requisitionId();

    String requisitionTitle();

    String status();

    default ApplicationRecord toRecord(String requestedId) {
        return new ApplicationRecord(
                orDefault(id(), requestedId),
                orDefault(candidateName(), "Candidate " + requestedId),
                orDefault(candidateEmail(), "candidate-" + requestedId + "@unknown.com"),
                orDefault(requisitionId(), "REQ-" + requestedId),
                orDefault(requisitionTitle(), "Unknown Position"),
                orDefault(status(), "Unknown")
        );
    }

    static ApplicationPayload parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new AtsResponseFormatException("Application response is not a JSON object");
        }
        if (node.path("candidate").isObject() || node.path("requisition").isObject()) {
            JsonNode candidate = node.path("candidate");
            JsonNode requisition = node.path("requisition");
            return new Nested(
                    text(node, "id"),
                    text(candidate, "name"),
                    text(candidate, "email"),
                    text(requisition, "id"),
                    text(requisition, "title"),
                    text(node, "status")
            );
        }
        if (node.has("candidateName") || node.has("candidateEmail")
                || node.has("requisitionId") || node.has("requisitionTitle")) {
            return new Flat(
                    text(node, "id"),
                    text(node, "candidateName"),
                    text(node, "candidateEmail"),
                    text(node, "requisitionId"),
                    text(node, "requisitionTitle"),
                    text(node, "status")
            );
        }
        throw new AtsResponseFormatException("Unrecognized application response shape");
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }

    record Flat(String id, String candidateName, String candidateEmail,
                String requisitionId, String requisitionTitle, String status) implements ApplicationPayload {
    }

    //candidate and requisition come as sub-objects
    record Nested(String id, String candidateName, String candidateEmail,
                  String requisitionId, String requisitionTitle, String status) implements ApplicationPayload {
    }
}
