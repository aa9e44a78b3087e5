package org.example.integrationservice.client.ats.exception;

import lombok.Getter;

/**
 * Base type of every failure raised by the ATS client.
 * <p>
 * {@code statusCode} is {@code null} when no HTTP response was received.
 * {@code retryable} tells the retry loop and the writeback queue whether another attempt can succeed.
 */
@Getter
public class AtsApiException extends RuntimeException {

    private final Integer statusCode;
    private final boolean retryable;

    public AtsApiException(String message, Integer statusCode, boolean retryable) {
        super(message);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public AtsApiException(String message, Integer statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }
}
