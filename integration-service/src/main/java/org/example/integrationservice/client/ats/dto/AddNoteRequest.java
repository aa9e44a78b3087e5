package org.example.integrationservice.client.ats.dto;

public record AddNoteRequest(
        String content,
        String noteType
) {
}
