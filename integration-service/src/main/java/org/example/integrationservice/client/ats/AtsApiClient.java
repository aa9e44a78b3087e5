package org.example.integrationservice.client.ats;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.client.ats.dto.AddNoteRequest;
import org.example.integrationservice.client.ats.dto.ApplicationPayload;
import org.example.integrationservice.client.ats.dto.ApplicationRecord;
import org.example.integrationservice.client.ats.dto.AtsMetricsSnapshot;
import org.example.integrationservice.client.ats.exception.AtsApiException;
import org.example.integrationservice.client.ats.exception.AtsNetworkException;
import org.example.integrationservice.client.ats.exception.AtsNotFoundException;
import org.example.integrationservice.client.ats.exception.AtsRateLimitException;
import org.example.integrationservice.client.ats.exception.AtsResponseFormatException;
import org.example.integrationservice.client.ats.exception.AtsServerException;
import org.example.integrationservice.core.config.AtsProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * REST client for the applicant tracking system.
 * <p>
 * Transient failures (429, 5xx, transport errors) are retried with backoff; everything else fails on the first
 * response. Note writes carry a content-derived {@code Idempotency-Key} so a retried POST cannot create a second note.
 */
@Component
@Slf4j
public class AtsApiClient {

    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final String NOTE_TYPE = "scheduling";

    private final RestClient restClient;
    private final RetryTemplate retryTemplate;
    private final AtsApiMetrics metrics;
    private final Clock clock;

    @Autowired
    public AtsApiClient(RestClient.Builder builder, AtsProperties properties, Clock clock) {
        this(builder, properties, clock, new ThreadWaitSleeper());
    }

    public AtsApiClient(RestClient.Builder builder, AtsProperties properties, Clock clock, Sleeper sleeper) {
        this.restClient = builder
                .baseUrl(properties.normalizedBaseUrl())
                .defaultHeader(API_KEY_HEADER, properties.getApiKey())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.USER_AGENT, "sched-integration/1.0")
                .build();
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(properties.getMaxRetries() + 1)
                .retryOn(AtsRateLimitException.class)
                .retryOn(AtsServerException.class)
                .retryOn(AtsNetworkException.class)
                .customBackoff(new RetryAfterBackOffPolicy(
                        properties.getRetryBaseDelay(), properties.getRetryMaxDelay(), sleeper))
                .build();
        this.metrics = new AtsApiMetrics(clock);
        this.clock = clock;
    }

    public ApplicationRecord getApplication(String applicationId) {
        JsonNode body;
        try {
            body = execute("GET application", () -> restClient.get()
                    .uri("/applications/{id}", applicationId)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::raise)
                    .body(JsonNode.class));
        } catch (AtsNotFoundException e) {
            throw new AtsNotFoundException("application", applicationId);
        }
        return ApplicationPayload.parse(body).toRecord(applicationId);
    }

    public void addApplicationNote(String applicationId, String noteText) {
        String idempotencyKey = idempotencyKey(applicationId, noteText);

        execute("POST application note", () -> restClient.post()
                .uri("/applications/{id}/notes", applicationId)
                .contentType(MediaType.APPLICATION_JSON)
                .header(IDEMPOTENCY_KEY_HEADER, idempotencyKey)
                .body(new AddNoteRequest(noteText, NOTE_TYPE))
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::raise)
                .toBodilessEntity());

        log.info("Note written to ATS application {}", applicationId);
    }

    public AtsMetricsSnapshot getMetrics() {
        return metrics.snapshot();
    }

    public AtsHealthStatus health() {
        return metrics.health();
    }

    public void resetMetrics() {
        metrics.reset();
    }

    /**
     * {@code sched-{applicationId}-{first 8 hex chars of SHA-256(noteText)}}, stable across retries and restarts.
     */
    public static String idempotencyKey(String applicationId, String noteText) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(noteText.getBytes(StandardCharsets.UTF_8));
            return "sched-" + applicationId + "-" + HexFormat.of().formatHex(digest).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private <T> T execute(String operation, Supplier<T> call) {
        return retryTemplate.execute(context -> {
            long started = System.nanoTime();
            try {
                T result = call.get();
                metrics.recordSuccess(elapsedMs(started));
                return result;
            } catch (AtsApiException e) {
                throw recordFailure(operation, context.getRetryCount() + 1, started, e);
            } catch (ResourceAccessException e) {
                throw recordFailure(operation, context.getRetryCount() + 1, started,
                        new AtsNetworkException("Network error talking to ATS: " + e.getMessage(), e));
            } catch (RestClientException e) {
                throw recordFailure(operation, context.getRetryCount() + 1, started,
                        new AtsResponseFormatException("Unreadable ATS response: " + e.getMessage()));
            }
        });
    }

    private AtsApiException recordFailure(String operation, int attempt, long started, AtsApiException failure) {
        metrics.recordFailure(elapsedMs(started), failure.getStatusCode(), failure.getMessage());
        if (failure.isRetryable()) {
            log.warn("ATS {} failed on attempt {}: {}", operation, attempt, failure.getMessage());
        } else {
            log.error("ATS {} failed with non-retryable error: {}", operation, failure.getMessage());
        }
        return failure;
    }

    private void raise(HttpRequest request, ClientHttpResponse response) throws IOException {
        String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        String retryAfter = response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER);
        throw AtsErrorClassifier.classify(response.getStatusCode().value(), body, retryAfter, clock.instant());
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
