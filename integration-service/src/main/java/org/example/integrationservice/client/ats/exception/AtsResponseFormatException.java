package org.example.integrationservice.client.ats.exception;

public class AtsResponseFormatException extends AtsApiException {
    public AtsResponseFormatException(String message) {
        super(message, null, false);
    }
}
