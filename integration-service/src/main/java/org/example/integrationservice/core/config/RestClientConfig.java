package org.example.integrationservice.core.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class RestClientConfig {

    //Note: WireMock should support HTTP/2 and normally fall back to HTTP/1.1 but the h2c upgrade breaks POST bodies

    @Bean
    public RestClientCustomizer jdkHttp11Customizer(
            @Value("${app.http.connect-timeout:5s}") Duration connectTimeout,
            @Value("${app.http.read-timeout:30s}") Duration readTimeout
    ) {
        var client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .build();
        var requestFactory = new JdkClientHttpRequestFactory(client);
        requestFactory.setReadTimeout(readTimeout);
        return builder -> builder.requestFactory(requestFactory);
    }

}
