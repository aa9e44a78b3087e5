package org.example.integrationservice.core.config;

import jakarta.annotation.PostConstruct;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.example.integrationservice.core.exception.InvalidConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

/**
 * OAuth client-credentials settings for the calendar provider.
 *
 * YAML prefix: {@code app.calendar}
 */
@Getter
@Setter
@ToString
@Validated
@ConfigurationProperties(prefix = "app.calendar")
public class CalendarProperties {

    @NotBlank
    private String tenantId;

    @NotBlank
    private String clientId;

    @NotBlank
    @ToString.Exclude
    private String clientSecret;

    @NotBlank
    private String scope = "https://graph.microsoft.com/.default";

    /** Host of the identity provider; the token URL is derived from it and the tenant. */
    @NotBlank
    private String issuer = "login.microsoftonline.com";

    /** Full token URL. Overrides the one derived from {@link #issuer} when set. */
    private String tokenEndpoint;

    /** Base URL of the calendar REST API. */
    @NotBlank
    private String apiBaseUrl = "https://graph.microsoft.com/v1.0";

    @PostConstruct
    void validate() {
        if (StringUtils.hasText(tokenEndpoint)
                && !tokenEndpoint.startsWith("http://") && !tokenEndpoint.startsWith("https://")) {
            throw new InvalidConfigurationException("app.calendar.token-endpoint must be an http(s) URL: " + tokenEndpoint);
        }
    }

    public String resolveTokenEndpoint() {
        if (StringUtils.hasText(tokenEndpoint)) {
            return tokenEndpoint;
        }
        return "https://" + issuer + "/" + tenantId + "/oauth2/v2.0/token";
    }
}
