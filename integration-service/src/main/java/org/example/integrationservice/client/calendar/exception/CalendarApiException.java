package org.example.integrationservice.client.calendar.exception;

import lombok.Getter;

@Getter
public class CalendarApiException extends RuntimeException {

    private final int statusCode;

    public CalendarApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public CalendarApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }
}
