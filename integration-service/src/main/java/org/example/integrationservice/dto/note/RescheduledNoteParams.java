package org.example.integrationservice.dto.note;

import java.time.Instant;
import java.util.List;

public record RescheduledNoteParams(
        String schedulingRequestId,
        String bookingId,
        String applicationId,
        List<String> interviewerEmails,
        String organizerEmail,
        Instant oldStartUtc,
        Instant oldEndUtc,
        Instant newStartUtc,
        Instant newEndUtc,
        String candidateTimezone,
        String calendarEventId,
        String reason
) {
}
