package org.example.integrationservice.client.ats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.integrationservice.client.ats.exception.*;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Maps a non-2xx ATS response onto the {@link AtsApiException} hierarchy.
 */
public final class AtsErrorClassifier {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int MAX_RAW_BODY_LENGTH = 200;

    private AtsErrorClassifier() {
    }

    public static AtsApiException classify(int statusCode, String body, String retryAfterHeader, Instant now) {
        String message = extractMessage(statusCode, body);

        return switch (statusCode) {
            case 400 -> new AtsBadRequestException(message);
            case 401 -> new AtsAuthException("Unauthorized: invalid or expired API key", 401);
            case 403 -> new AtsAuthException("Forbidden: insufficient permissions", 403);
            case 404 -> new AtsNotFoundException(message);
            case 429 -> new AtsRateLimitException(message, parseRetryAfter(retryAfterHeader, now));
            default -> statusCode >= 500
                    ? new AtsServerException(message, statusCode)
                    : new AtsApiException(message, statusCode, false);
        };
    }

    static String extractMessage(int statusCode, String body) {
        String fallback = "ATS API error: " + statusCode;
        if (!StringUtils.hasText(body)) {
            return fallback;
        }
        try {
            JsonNode node = MAPPER.readTree(body);
            if (node.hasNonNull("error") && node.get("error").isTextual()) {
                return node.get("error").asText();
            }
            if (node.hasNonNull("message") && node.get("message").isTextual()) {
                return node.get("message").asText();
            }
            return fallback;
        } catch (JsonProcessingException e) {
            return body.length() < MAX_RAW_BODY_LENGTH ? body : fallback;
        }
    }

    /**
     * Accepts delta-seconds or an RFC 1123 HTTP date. Anything else, or a moment already in the past, yields {@code null}.
     */
    public static Duration parseRetryAfter(String header, Instant now) {
        if (!StringUtils.hasText(header)) {
            return null;
        }
        String value = header.trim();
        if (value.length() <= 9 && value.chars().allMatch(Character::isDigit)) {
            long seconds = Long.parseLong(value);
            return seconds > 0 ? Duration.ofSeconds(seconds) : null;
        }
        try {
            Instant until = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration wait = Duration.between(now, until);
            return wait.isNegative() || wait.isZero() ? null : wait;
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
