package org.example.integrationservice.core.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class SyncJobNotFoundException extends RuntimeException {
    public SyncJobNotFoundException(UUID jobId) {
        super("Cannot find sync job with id: " + jobId);
    }
}
