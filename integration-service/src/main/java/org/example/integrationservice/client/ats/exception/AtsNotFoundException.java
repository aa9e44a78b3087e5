package org.example.integrationservice.client.ats.exception;

public class AtsNotFoundException extends AtsApiException {
    public AtsNotFoundException(String message) {
        super(message, 404, false);
    }

    public AtsNotFoundException(String resourceType, String resourceId) {
        this(resourceType + " not found: " + resourceId);
    }
}
