package org.example.integrationservice.core.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Inbound webhook settings.
 *
 * YAML prefix: {@code app.webhook}
 */
@Getter
@Setter
@ToString
@Validated
@ConfigurationProperties(prefix = "app.webhook")
public class WebhookProperties {

    /** Shared HMAC-SHA256 secret agreed with the ATS. */
    @NotBlank
    @ToString.Exclude
    private String secret;

    /** Processing attempts before an event is parked as failed. */
    @Min(1)
    private int maxAttempts = 3;

    /** Events claimed per worker tick. */
    @Min(1)
    private int batchSize = 10;
}
