package org.example.integrationservice.dto.note;

import java.time.Instant;
import java.util.List;

public record BookedNoteParams(
        String schedulingRequestId,
        String bookingId,
        String applicationId,
        List<String> interviewerEmails,
        String organizerEmail,
        Instant scheduledStartUtc,
        Instant scheduledEndUtc,
        String candidateTimezone,
        String calendarEventId,
        String joinUrl
) {
}
