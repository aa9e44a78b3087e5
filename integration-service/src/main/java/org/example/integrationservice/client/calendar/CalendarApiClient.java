package org.example.integrationservice.client.calendar;

import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.client.calendar.exception.CalendarApiException;
import org.example.integrationservice.core.config.CalendarProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Calendar operations issued on behalf of an organizer mailbox with the app-only token.
 */
@Component
@Slf4j
public class CalendarApiClient {

    private final RestClient restClient;
    private final CalendarTokenManager tokenManager;

    public CalendarApiClient(RestClient.Builder builder, CalendarProperties properties, CalendarTokenManager tokenManager) {
        this.restClient = builder.baseUrl(properties.getApiBaseUrl()).build();
        this.tokenManager = tokenManager;
    }

    /**
     * Deletes an event from the organizer's calendar. An event that is already gone counts as cancelled.
     * A rejected token is dropped and the call is repeated once with a fresh one.
     */
    public void cancelEvent(String organizerEmail, String eventId) {
        try {
            try {
                deleteEvent(organizerEmail, eventId);
            } catch (HttpClientErrorException.Unauthorized e) {
                log.warn("Calendar API rejected the access token, refreshing and retrying once");
                tokenManager.clearToken();
                deleteEvent(organizerEmail, eventId);
            }
            log.info("Calendar event {} cancelled", eventId);
        } catch (HttpClientErrorException.NotFound e) {
            log.info("Calendar event {} not found, treating as already cancelled", eventId);
        } catch (RestClientResponseException e) {
            throw new CalendarApiException("Failed to cancel calendar event: " + e.getStatusCode().value(),
                    e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            throw new CalendarApiException("Calendar API unreachable: " + e.getMessage(), e);
        }
    }

    private void deleteEvent(String organizerEmail, String eventId) {
        restClient.delete()
                .uri("/users/{organizer}/events/{eventId}", organizerEmail, eventId)
                .headers(headers -> headers.setBearerAuth(tokenManager.getToken()))
                .retrieve()
                .toBodilessEntity();
    }
}
