package org.example.integrationservice.dto.note;

import java.time.Instant;
import java.util.List;

public record LinkCreatedNoteParams(
        String schedulingRequestId,
        String applicationId,
        String publicLink,
        List<String> interviewerEmails,
        String organizerEmail,
        String interviewType,
        int durationMinutes,
        Instant windowStart,
        Instant windowEnd,
        String candidateTimezone
) {
}
