package org.example.integrationservice.client.calendar.exception;

import lombok.Getter;

@Getter
public class CalendarTokenException extends RuntimeException {

    //0 when the token endpoint was never reached
    private final int statusCode;

    public CalendarTokenException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public CalendarTokenException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }
}
