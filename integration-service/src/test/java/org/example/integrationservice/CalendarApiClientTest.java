package org.example.integrationservice;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import org.example.integrationservice.client.calendar.CalendarApiClient;
import org.example.integrationservice.client.calendar.CalendarTokenManager;
import org.example.integrationservice.client.calendar.exception.CalendarApiException;
import org.example.integrationservice.core.config.CalendarProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Instant;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static com.github.tomakehurst.wiremock.stubbing.Scenario.STARTED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalendarApiClientTest {

    @RegisterExtension
    static WireMockExtension wireMock = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private static final String TOKEN_PATH = "/token";
    private static final String EVENT_PATH = "/calendar/users/organizer@example.com/events/evt-42";

    private CalendarApiClient calendarApiClient;

    @BeforeEach
    void setUp() {
        CalendarProperties properties = new CalendarProperties();
        properties.setTenantId("tenant");
        properties.setClientId("client-id");
        properties.setClientSecret("client-secret-value");
        properties.setTokenEndpoint(wireMock.baseUrl() + TOKEN_PATH);
        properties.setApiBaseUrl(wireMock.baseUrl() + "/calendar");

        MutableClock clock = new MutableClock(Instant.parse("2026-03-02T09:00:00Z"));
        CalendarTokenManager tokenManager = new CalendarTokenManager(builder(), properties, clock);
        calendarApiClient = new CalendarApiClient(builder(), properties, tokenManager);

        wireMock.stubFor(post(urlEqualTo(TOKEN_PATH))
                .willReturn(okJson("{\"access_token\":\"token-1\",\"token_type\":\"Bearer\",\"expires_in\":3600}")));
    }

    private static RestClient.Builder builder() {
        return RestClient.builder()
                .requestFactory(new JdkClientHttpRequestFactory(
                        HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build()));
    }

    @Test
    @DisplayName("Should send the bearer token when deleting the event")
    void testCancelEvent_Success() {
        wireMock.stubFor(delete(urlEqualTo(EVENT_PATH)).willReturn(aResponse().withStatus(204)));

        calendarApiClient.cancelEvent("organizer@example.com", "evt-42");

        wireMock.verify(1, deleteRequestedFor(urlEqualTo(EVENT_PATH))
                .withHeader("Authorization", equalTo("Bearer token-1")));
    }

    @Test
    @DisplayName("Should drop the token and retry once when the API answers 401")
    void testCancelEvent_RetriesOnceAfterUnauthorized() {
        wireMock.stubFor(delete(urlEqualTo(EVENT_PATH)).inScenario("expired")
                .whenScenarioStateIs(STARTED)
                .willReturn(aResponse().withStatus(401))
                .willSetStateTo("refreshed"));
        wireMock.stubFor(delete(urlEqualTo(EVENT_PATH)).inScenario("expired")
                .whenScenarioStateIs("refreshed")
                .willReturn(aResponse().withStatus(204)));

        calendarApiClient.cancelEvent("organizer@example.com", "evt-42");

        wireMock.verify(2, deleteRequestedFor(urlEqualTo(EVENT_PATH)));
        wireMock.verify(2, postRequestedFor(urlEqualTo(TOKEN_PATH)));
    }

    @Test
    @DisplayName("Should treat a missing event as already cancelled")
    void testCancelEvent_NotFoundIsSuccess() {
        wireMock.stubFor(delete(urlEqualTo(EVENT_PATH)).willReturn(aResponse().withStatus(404)));

        assertThatCode(() -> calendarApiClient.cancelEvent("organizer@example.com", "evt-42"))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should raise CalendarApiException with the status for other failures")
    void testCancelEvent_ServerError() {
        wireMock.stubFor(delete(urlEqualTo(EVENT_PATH)).willReturn(aResponse().withStatus(500)));

        assertThatThrownBy(() -> calendarApiClient.cancelEvent("organizer@example.com", "evt-42"))
                .isInstanceOf(CalendarApiException.class)
                .satisfies(e -> assertThat(((CalendarApiException) e).getStatusCode()).isEqualTo(500));
    }
}
