package org.example.integrationservice.core.config;

import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.client.ats.exception.AtsApiException;
import org.example.integrationservice.client.calendar.exception.CalendarApiException;
import org.example.integrationservice.client.calendar.exception.CalendarTokenException;
import org.example.integrationservice.core.exception.InvalidJobStateException;
import org.example.integrationservice.core.exception.SyncJobNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SyncJobNotFoundException.class)
    public ResponseEntity<Object> handleJobNotFound(SyncJobNotFoundException ex) {
        return buildResponse(HttpStatus.NOT_FOUND, "SYNC_JOB_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(InvalidJobStateException.class)
    public ResponseEntity<Object> handleJobState(InvalidJobStateException ex) {
        return buildResponse(HttpStatus.CONFLICT, "INVALID_JOB_STATE", ex.getMessage());
    }

    @ExceptionHandler(AtsApiException.class)
    public ResponseEntity<Object> handleAts(AtsApiException ex) {
        log.error("ATS call escaped to the web layer: {}", ex.getMessage());
        return buildResponse(HttpStatus.BAD_GATEWAY, "ATS_ERROR", ex.getMessage());
    }

    @ExceptionHandler({CalendarTokenException.class, CalendarApiException.class})
    public ResponseEntity<Object> handleCalendar(RuntimeException ex) {
        log.error("Calendar call escaped to the web layer: {}", ex.getMessage());
        return buildResponse(HttpStatus.BAD_GATEWAY, "CALENDAR_ERROR", ex.getMessage());
    }

    private ResponseEntity<Object> buildResponse(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now());
        body.put("status", status.value());
        body.put("error", code);
        body.put("message", message);
        return new ResponseEntity<>(body, status);
    }
}
