package org.example.integrationservice.service.writeback;

import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.dto.note.BookedNoteParams;
import org.example.integrationservice.dto.note.CancelledNoteParams;
import org.example.integrationservice.dto.note.LinkCreatedNoteParams;
import org.example.integrationservice.dto.note.RescheduledNoteParams;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders the plain-text notes written to ATS applications. Output is deterministic for a given input, which keeps
 * the note idempotency key stable across retries.
 */
@Component
@Slf4j
public class NoteFormatter {

    private static final DateTimeFormatter LOCAL_FORMAT =
            DateTimeFormatter.ofPattern("EEE, MMM d, yyyy, h:mm a z", Locale.US);
    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final String NOT_AVAILABLE = "N/A";

    public String formatLinkCreated(LinkCreatedNoteParams params) {
        return String.join("\n", List.of(
                "=== SCHEDULING LINK CREATED ===",
                "",
                "Scheduling Request ID: " + params.schedulingRequestId(),
                "Application ID: " + orNa(params.applicationId()),
                "",
                "Public Link: " + params.publicLink(),
                "",
                "Interview Type: " + params.interviewType(),
                "Duration: " + params.durationMinutes() + " minutes",
                "",
                "Interviewer(s): " + interviewers(params.interviewerEmails()),
                "Organizer: " + params.organizerEmail(),
                "",
                "Available Window:",
                "  Start: " + utc(params.windowStart()) + " (UTC)",
                "  End: " + utc(params.windowEnd()) + " (UTC)",
                "  Candidate Timezone: " + params.candidateTimezone(),
                "",
                "================================"
        ));
    }

    public String formatBooked(BookedNoteParams params) {
        return String.join("\n", List.of(
                "=== INTERVIEW BOOKED ===",
                "",
                "Scheduling Request ID: " + params.schedulingRequestId(),
                "Booking ID: " + params.bookingId(),
                "Application ID: " + orNa(params.applicationId()),
                "",
                "Scheduled Time (UTC):",
                "  Start: " + utc(params.scheduledStartUtc()),
                "  End: " + utc(params.scheduledEndUtc()),
                "",
                "Scheduled Time (" + params.candidateTimezone() + "):",
                "  Start: " + local(params.scheduledStartUtc(), params.candidateTimezone()),
                "  End: " + local(params.scheduledEndUtc(), params.candidateTimezone()),
                "",
                "Interviewer(s): " + interviewers(params.interviewerEmails()),
                "Organizer: " + params.organizerEmail(),
                "",
                "Calendar Event ID: " + orNa(params.calendarEventId()),
                "Join URL: " + orNa(params.joinUrl()),
                "",
                "========================"
        ));
    }

    public String formatCancelled(CancelledNoteParams params) {
        return String.join("\n", List.of(
                "=== INTERVIEW CANCELLED ===",
                "",
                "Scheduling Request ID: " + params.schedulingRequestId(),
                "Booking ID: " + orNa(params.bookingId()),
                "Application ID: " + orNa(params.applicationId()),
                "",
                "Cancelled By: " + params.cancelledBy(),
                "Reason: " + params.reason(),
                "",
                "Interviewer(s): " + interviewers(params.interviewerEmails()),
                "Organizer: " + params.organizerEmail(),
                "",
                "==========================="
        ));
    }

    public String formatRescheduled(RescheduledNoteParams params) {
        return String.join("\n", List.of(
                "=== INTERVIEW RESCHEDULED ===",
                "",
                "Scheduling Request ID: " + params.schedulingRequestId(),
                "Booking ID: " + params.bookingId(),
                "Application ID: " + orNa(params.applicationId()),
                "",
                "Previous Time (UTC):",
                "  Start: " + utc(params.oldStartUtc()),
                "  End: " + utc(params.oldEndUtc()),
                "",
                "New Time (UTC):",
                "  Start: " + utc(params.newStartUtc()),
                "  End: " + utc(params.newEndUtc()),
                "",
                "New Time (" + params.candidateTimezone() + "):",
                "  Start: " + local(params.newStartUtc(), params.candidateTimezone()),
                "  End: " + local(params.newEndUtc(), params.candidateTimezone()),
                "",
                "Interviewer(s): " + interviewers(params.interviewerEmails()),
                "Organizer: " + params.organizerEmail(),
                "",
                "Calendar Event ID: " + orNa(params.calendarEventId()),
                "Reason: " + (params.reason() == null || params.reason().isBlank() ? "Not specified" : params.reason()),
                "",
                "============================="
        ));
    }

    private static String utc(Instant instant) {
        return instant == null ? NOT_AVAILABLE : DateTimeFormatter.ISO_INSTANT.format(instant);
    }

    private static String local(Instant instant, String timezone) {
        if (instant == null) {
            return NOT_AVAILABLE;
        }
        return LOCAL_FORMAT.withZone(zoneOrUtc(timezone)).format(instant);
    }

    private static ZoneId zoneOrUtc(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return UTC;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            log.warn("Unknown candidate timezone '{}', rendering in UTC", timezone);
            return UTC;
        }
    }

    private static String interviewers(List<String> emails) {
        return emails == null || emails.isEmpty() ? NOT_AVAILABLE : String.join(", ", emails);
    }

    private static String orNa(String value) {
        return value == null || value.isBlank() ? NOT_AVAILABLE : value;
    }
}
