package org.example.integrationservice.service;

import org.example.integrationservice.dto.note.BookedNoteParams;
import org.example.integrationservice.dto.note.CancelledNoteParams;
import org.example.integrationservice.dto.note.LinkCreatedNoteParams;
import org.example.integrationservice.dto.note.RescheduledNoteParams;
import org.example.integrationservice.dto.note.WritebackResult;
import org.example.integrationservice.model.SyncJob;

import java.time.Instant;

/**
 * Writes scheduling milestones back to the candidate's ATS application as notes.
 * <p>
 * A failed write never surfaces as an exception: it is recorded in the audit log and parked as a sync job for the
 * retry worker. Requests without an application id are a successful no-op.
 */
public interface WritebackService {

    WritebackResult writeLinkCreatedNote(LinkCreatedNoteParams params);

    WritebackResult writeBookedNote(BookedNoteParams params);

    WritebackResult writeCancelledNote(CancelledNoteParams params);

    WritebackResult writeRescheduledNote(RescheduledNoteParams params);

    /**
     * Replays a queued note from its stored payload. The job itself is left untouched; the caller owns its state.
     */
    WritebackResult retryJob(SyncJob job);

    Instant calculateNextRunAfter(int attempts);
}
