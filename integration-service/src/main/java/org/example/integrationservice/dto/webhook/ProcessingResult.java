package org.example.integrationservice.dto.webhook;

public record ProcessingResult(
        boolean success,
        String error
) {
    public static ProcessingResult ok() {
        return new ProcessingResult(true, null);
    }

    public static ProcessingResult failure(String error) {
        return new ProcessingResult(false, error);
    }
}
