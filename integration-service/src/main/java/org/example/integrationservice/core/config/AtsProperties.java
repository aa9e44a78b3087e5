package org.example.integrationservice.core.config;

import jakarta.annotation.PostConstruct;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.example.integrationservice.core.exception.InvalidConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection settings for the applicant tracking system REST API.
 *
 * YAML prefix: {@code app.ats}
 */
@Getter
@Setter
@ToString
@Validated
@ConfigurationProperties(prefix = "app.ats")
public class AtsProperties {

    static final int MIN_API_KEY_LENGTH = 10;

    /** Base URL of the ATS API, for example {@code https://api.ats.example.com/v1}. */
    @NotBlank
    private String baseUrl;

    /** Sent as {@code X-API-Key} on every request. */
    @NotBlank
    @ToString.Exclude
    private String apiKey;

    /** Retries after the first attempt, so {@code 3} means at most four calls. */
    @Min(0)
    @Max(10)
    private int maxRetries = 3;

    /** Starting delay of the exponential backoff. */
    @NotNull
    private Duration retryBaseDelay = Duration.ofSeconds(1);

    /** Cap for the exponential backoff, jitter included. */
    @NotNull
    private Duration retryMaxDelay = Duration.ofSeconds(30);

    @PostConstruct
    void validate() {
        if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
            throw new InvalidConfigurationException("app.ats.base-url must be an http(s) URL: " + baseUrl);
        }
        if (apiKey.length() < MIN_API_KEY_LENGTH) {
            throw new InvalidConfigurationException("app.ats.api-key looks truncated (shorter than " + MIN_API_KEY_LENGTH + " characters)");
        }
        if (retryMaxDelay.compareTo(retryBaseDelay) < 0) {
            throw new InvalidConfigurationException("app.ats.retry-max-delay must not be shorter than app.ats.retry-base-delay");
        }
    }

    public String normalizedBaseUrl() {
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
}
