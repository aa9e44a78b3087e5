package org.example.integrationservice.client.ats.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class AtsRateLimitException extends AtsApiException {

    //Null when the response carried no usable Retry-After header
    private final Duration retryAfter;

    public AtsRateLimitException(String message, Duration retryAfter) {
        super(message, 429, true);
        this.retryAfter = retryAfter;
    }
}
