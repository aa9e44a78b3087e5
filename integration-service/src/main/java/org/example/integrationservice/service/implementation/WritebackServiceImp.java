package org.example.integrationservice.service.implementation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.client.ats.AtsApiClient;
import org.example.integrationservice.core.config.SyncProperties;
import org.example.integrationservice.core.util.BackoffSchedule;
import org.example.integrationservice.dto.note.BookedNoteParams;
import org.example.integrationservice.dto.note.CancelledNoteParams;
import org.example.integrationservice.dto.note.LinkCreatedNoteParams;
import org.example.integrationservice.dto.note.NoteType;
import org.example.integrationservice.dto.note.RescheduledNoteParams;
import org.example.integrationservice.dto.note.WritebackResult;
import org.example.integrationservice.model.AuditAction;
import org.example.integrationservice.model.SyncEntityType;
import org.example.integrationservice.model.SyncJob;
import org.example.integrationservice.model.SyncJobStatus;
import org.example.integrationservice.model.SyncJobType;
import org.example.integrationservice.repository.SyncJobRepository;
import org.example.integrationservice.service.AuditService;
import org.example.integrationservice.service.WritebackService;
import org.example.integrationservice.service.writeback.NoteFormatter;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class WritebackServiceImp implements WritebackService {

    private static final int MAX_AUDIT_ERROR_LENGTH = 500;
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final AtsApiClient atsApiClient;
    private final SyncJobRepository syncJobRepository;
    private final AuditService auditService;
    private final NoteFormatter noteFormatter;
    private final SyncProperties syncProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public WritebackResult writeLinkCreatedNote(LinkCreatedNoteParams params) {
        if (!StringUtils.hasText(params.applicationId())) {
            return skipped(params.schedulingRequestId());
        }
        return writeNote(new NoteTarget(params.applicationId(), NoteType.LINK_CREATED,
                        SyncEntityType.SCHEDULING_REQUEST, params.schedulingRequestId()),
                noteFormatter.formatLinkCreated(params), params);
    }

    @Override
    public WritebackResult writeBookedNote(BookedNoteParams params) {
        if (!StringUtils.hasText(params.applicationId())) {
            return skipped(params.schedulingRequestId());
        }
        return writeNote(new NoteTarget(params.applicationId(), NoteType.BOOKED,
                        SyncEntityType.BOOKING, params.bookingId()),
                noteFormatter.formatBooked(params), params);
    }

    @Override
    public WritebackResult writeCancelledNote(CancelledNoteParams params) {
        if (!StringUtils.hasText(params.applicationId())) {
            return skipped(params.schedulingRequestId());
        }
        return writeNote(new NoteTarget(params.applicationId(), NoteType.CANCELLED,
                        SyncEntityType.SCHEDULING_REQUEST, params.schedulingRequestId()),
                noteFormatter.formatCancelled(params), params);
    }

    @Override
    public WritebackResult writeRescheduledNote(RescheduledNoteParams params) {
        if (!StringUtils.hasText(params.applicationId())) {
            return skipped(params.schedulingRequestId());
        }
        return writeNote(new NoteTarget(params.applicationId(), NoteType.RESCHEDULED,
                        SyncEntityType.BOOKING, params.bookingId()),
                noteFormatter.formatRescheduled(params), params);
    }

    @Override
    public WritebackResult retryJob(SyncJob job) {
        Map<String, Object> payload = job.getPayload();
        Object applicationId = payload == null ? null : payload.get("applicationId");
        Object noteText = payload == null ? null : payload.get("noteText");

        if (!(applicationId instanceof String appId) || !StringUtils.hasText(appId) || !(noteText instanceof String text)) {
            return WritebackResult.failed("Sync job " + job.getId() + " payload has no applicationId/noteText to replay");
        }

        String noteType = String.valueOf(payload.get("noteType"));
        NoteTarget target = new NoteTarget(appId, NoteType.fromValue(noteType).orElse(null),
                job.getEntityType(), job.getEntityId());

        logAttempt(target);
        try {
            atsApiClient.addApplicationNote(appId, text);
            logSuccess(target);
            return WritebackResult.ok();
        } catch (RuntimeException e) {
            String error = errorMessage(e);
            logFailure(target, error);
            return WritebackResult.failed(error);
        }
    }

    @Override
    public Instant calculateNextRunAfter(int attempts) {
        return BackoffSchedule.nextRunAfter(attempts, clock.instant());
    }

    private WritebackResult writeNote(NoteTarget target, String noteText, Object params) {
        logAttempt(target);
        try {
            atsApiClient.addApplicationNote(target.applicationId(), noteText);
            logSuccess(target);
            return WritebackResult.ok();
        } catch (RuntimeException e) {
            String error = errorMessage(e);
            logFailure(target, error);
            UUID jobId = createRetryJob(target, noteText, params, error);
            return WritebackResult.queued(error, jobId);
        }
    }

    private UUID createRetryJob(NoteTarget target, String noteText, Object params, String error) {
        Map<String, Object> payload = new LinkedHashMap<>(objectMapper.convertValue(params, PAYLOAD_TYPE));
        payload.put("applicationId", target.applicationId());
        payload.put("noteText", noteText);
        payload.put("noteType", target.noteTypeValue());

        Instant now = clock.instant();
        SyncJob job = SyncJob.builder()
                .type(SyncJobType.ATS_NOTE)
                .entityType(target.entityType())
                .entityId(target.entityId())
                .payload(payload)
                .status(SyncJobStatus.PENDING)
                .attempts(0)
                .maxAttempts(syncProperties.getMaxAttempts())
                .lastError(truncate(error))
                .runAfter(BackoffSchedule.nextRunAfter(0, now))
                .createdAt(now)
                .updatedAt(now)
                .build();
        SyncJob saved = syncJobRepository.save(job);

        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("syncJobId", saved.getId().toString());
        audit.put("type", SyncJobType.ATS_NOTE.name());
        audit.put("noteType", target.noteTypeValue());
        audit.put("applicationId", target.applicationId());
        audit.put("runAfter", saved.getRunAfter().toString());
        auditService.record(AuditAction.SYNC_JOB_CREATED, target.requestId(), target.bookingId(), audit);

        log.warn("ATS note for application {} queued for retry as sync job {}", target.applicationId(), saved.getId());
        return saved.getId();
    }

    private void logAttempt(NoteTarget target) {
        auditService.record(AuditAction.ATS_NOTE_ATTEMPT, target.requestId(), target.bookingId(), target.auditFields());
    }

    private void logSuccess(NoteTarget target) {
        auditService.record(AuditAction.ATS_NOTE_SUCCESS, target.requestId(), target.bookingId(), target.auditFields());
    }

    private void logFailure(NoteTarget target, String error) {
        Map<String, Object> audit = target.auditFields();
        audit.put("error", truncate(error));
        auditService.record(AuditAction.ATS_NOTE_FAILED, target.requestId(), target.bookingId(), audit);
        log.error("ATS note ({}) for application {} failed: {}", target.noteTypeValue(), target.applicationId(), error);
    }

    private WritebackResult skipped(String schedulingRequestId) {
        log.debug("No ATS application linked to scheduling request {}, skipping note", schedulingRequestId);
        return WritebackResult.ok();
    }

    private static String errorMessage(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String truncate(String value) {
        return value.length() > MAX_AUDIT_ERROR_LENGTH ? value.substring(0, MAX_AUDIT_ERROR_LENGTH) : value;
    }

    private record NoteTarget(String applicationId, NoteType noteType, SyncEntityType entityType, String entityId) {

        String noteTypeValue() {
            return noteType != null ? noteType.getValue() : "unknown";
        }

        String requestId() {
            return entityType == SyncEntityType.SCHEDULING_REQUEST ? entityId : null;
        }

        String bookingId() {
            return entityType == SyncEntityType.BOOKING ? entityId : null;
        }

        Map<String, Object> auditFields() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("applicationId", applicationId);
            fields.put("noteType", noteTypeValue());
            fields.put("entityId", entityId);
            return fields;
        }
    }
}
