package org.muralis.maps.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * HTTP client used for every Google Maps lookup. Both timeouts are bounded so a stalled
 * provider surfaces as a recoverable failure instead of blocking a tool call.
 */
@Slf4j
@Configuration
public class RestClientConfig {

    @Value("${app.google-maps.base-url}")
    private String baseUrl;

    @Value("${app.google-maps.api-key}")
    private String apiKey;

    @Value("${app.google-maps.connect-timeout:5s}")
    private Duration connectTimeout;

    @Value("${app.google-maps.read-timeout:10s}")
    private Duration readTimeout;

    @Bean
    public RestClient googleMapsRestClient(RestClient.Builder builder) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("app.google-maps.api-key is not set; Google Maps requests will be denied");
        }
        log.info("Configuring Google Maps client: baseUrl={}, connectTimeout={}, readTimeout={}",
                baseUrl, connectTimeout, readTimeout);

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(readTimeout);

        return builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
