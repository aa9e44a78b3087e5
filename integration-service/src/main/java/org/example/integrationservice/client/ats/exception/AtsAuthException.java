package org.example.integrationservice.client.ats.exception;

public class AtsAuthException extends AtsApiException {
    public AtsAuthException(String message, int statusCode) {
        super(message, statusCode, false);
    }
}
