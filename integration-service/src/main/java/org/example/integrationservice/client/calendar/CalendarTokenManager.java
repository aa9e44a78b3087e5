package org.example.integrationservice.client.calendar;

import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.client.calendar.dto.TokenMetrics;
import org.example.integrationservice.client.calendar.dto.TokenResponse;
import org.example.integrationservice.client.calendar.dto.TokenStatus;
import org.example.integrationservice.client.calendar.exception.CalendarTokenException;
import org.example.integrationservice.core.config.CalendarProperties;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Caches the app-only access token for the calendar API.
 * <p>
 * A token is handed out until five minutes before it expires. When a refresh is needed, the first caller performs it
 * and every caller arriving meanwhile waits on the same result, success or failure, so a burst of requests costs a
 * single round trip to the identity provider.
 */
@Component
@Slf4j
public class CalendarTokenManager {

    public static final Duration EARLY_REFRESH_WINDOW = Duration.ofMinutes(5);

    private final RestClient restClient;
    private final CalendarProperties properties;
    private final Clock clock;

    private final Object monitor = new Object();

    // guarded by monitor
    private String accessToken;
    private Instant expiresAt;
    private CompletableFuture<String> inFlightRefresh;
    private long tokenRefreshes;
    private long tokenFailures;
    private Instant lastRefreshAt;
    private Instant lastFailureAt;
    private String lastError;

    public CalendarTokenManager(RestClient.Builder builder, CalendarProperties properties, Clock clock) {
        this.restClient = builder.build();
        this.properties = properties;
        this.clock = clock;
    }

    public String getToken() {
        CompletableFuture<String> refresh;
        boolean leader = false;

        synchronized (monitor) {
            if (accessToken != null && clock.instant().isBefore(expiresAt.minus(EARLY_REFRESH_WINDOW))) {
                return accessToken;
            }
            if (inFlightRefresh == null) {
                inFlightRefresh = new CompletableFuture<>();
                leader = true;
            }
            refresh = inFlightRefresh;
        }

        if (leader) {
            refresh(refresh);
        }
        return await(refresh);
    }

    /**
     * Drops the cached token, typically after the calendar API rejected it with a 401.
     */
    public void clearToken() {
        synchronized (monitor) {
            accessToken = null;
            expiresAt = null;
        }
        log.info("Calendar access token cleared");
    }

    public TokenStatus getTokenStatus() {
        synchronized (monitor) {
            if (accessToken == null) {
                return new TokenStatus(false, null, null);
            }
            Instant now = clock.instant();
            return new TokenStatus(
                    expiresAt.isAfter(now),
                    expiresAt,
                    Math.max(0, Duration.between(now, expiresAt).getSeconds())
            );
        }
    }

    public TokenMetrics getMetrics() {
        synchronized (monitor) {
            return new TokenMetrics(tokenRefreshes, tokenFailures, lastRefreshAt, lastFailureAt, lastError);
        }
    }

    public void resetMetrics() {
        synchronized (monitor) {
            tokenRefreshes = 0;
            tokenFailures = 0;
            lastRefreshAt = null;
            lastFailureAt = null;
            lastError = null;
        }
    }

    private void refresh(CompletableFuture<String> refresh) {
        String token = null;
        CalendarTokenException failure = null;
        try {
            token = requestToken();
        } catch (CalendarTokenException e) {
            failure = e;
        } catch (RuntimeException e) {
            failure = new CalendarTokenException("Token refresh failed: " + e.getMessage(), e);
        } finally {
            // cleared before settling so a caller arriving after a failure starts a fresh refresh
            synchronized (monitor) {
                if (inFlightRefresh == refresh) {
                    inFlightRefresh = null;
                }
            }
        }

        if (failure != null) {
            refresh.completeExceptionally(failure);
        } else {
            refresh.complete(token);
        }
    }

    private String await(CompletableFuture<String> refresh) {
        try {
            return refresh.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof CalendarTokenException tokenException) {
                throw tokenException;
            }
            throw new CalendarTokenException("Token refresh failed: " + e.getMessage(), e.getCause());
        }
    }

    private String requestToken() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", properties.getClientId());
        form.add("client_secret", properties.getClientSecret());
        form.add("scope", properties.getScope());
        form.add("grant_type", "client_credentials");

        TokenResponse response;
        try {
            response = restClient.post()
                    .uri(properties.resolveTokenEndpoint())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, errorResponse) -> {
                        int status = errorResponse.getStatusCode().value();
                        String body = StreamUtils.copyToString(errorResponse.getBody(), StandardCharsets.UTF_8);
                        throw new CalendarTokenException("Token refresh failed: " + status + " - " + body, status);
                    })
                    .body(TokenResponse.class);
        } catch (CalendarTokenException e) {
            throw recordFailure(e);
        } catch (RestClientException e) {
            throw recordFailure(new CalendarTokenException("Token refresh failed: " + e.getMessage(), e));
        }

        if (response == null || response.accessToken() == null || response.accessToken().isBlank()) {
            throw recordFailure(new CalendarTokenException("Token refresh failed: response carried no access_token", 200));
        }

        synchronized (monitor) {
            Instant now = clock.instant();
            accessToken = response.accessToken();
            expiresAt = now.plusSeconds(response.expiresIn());
            tokenRefreshes++;
            lastRefreshAt = now;
        }
        log.info("Calendar access token refreshed, valid for {}s", response.expiresIn());
        return response.accessToken();
    }

    private CalendarTokenException recordFailure(CalendarTokenException failure) {
        synchronized (monitor) {
            tokenFailures++;
            lastFailureAt = clock.instant();
            lastError = failure.getMessage();
        }
        log.error("Calendar token refresh failed (status {}): {}", failure.getStatusCode(), failure.getMessage());
        return failure;
    }
}
