package org.example.integrationservice.client.ats.exception;

public class AtsServerException extends AtsApiException {
    public AtsServerException(String message, int statusCode) {
        super(message, statusCode, true);
    }
}
