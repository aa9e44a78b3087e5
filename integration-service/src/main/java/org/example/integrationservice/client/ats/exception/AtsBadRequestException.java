package org.example.integrationservice.client.ats.exception;

public class AtsBadRequestException extends AtsApiException {
    public AtsBadRequestException(String message) {
        super(message, 400, false);
    }
}
