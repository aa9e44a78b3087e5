package org.example.integrationservice.client.ats.exception;

public class AtsNetworkException extends AtsApiException {
    public AtsNetworkException(String message, Throwable cause) {
        super(message, null, true, cause);
    }
}
