package org.example.integrationservice.dto.note;

import java.util.List;

public record CancelledNoteParams(
        String schedulingRequestId,
        String bookingId,
        String applicationId,
        List<String> interviewerEmails,
        String organizerEmail,
        String reason,
        String cancelledBy
) {
}
