package com.vtrader.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Connection settings and HTTP client for the Vortex market-data/broker REST API.
 *
 * <p>Binds to the {@code vortex.*} prefix. Session acquisition (OAuth token exchange)
 * happens elsewhere; this service only needs the resulting access token.
 */
@Configuration
@ConfigurationProperties(prefix = "vortex")
@Getter
@Setter
public class VortexConfig {

    private static final Logger log = LoggerFactory.getLogger(VortexConfig.class);

    private String baseUrl = "https://vortex-api.rupeezy.in/v2";

    private String apiKey;

    private String accessToken;

    private Duration connectTimeout = Duration.ofSeconds(5);

    /** Upper bound for one upstream round trip; the dispatch loop waits on it. */
    private Duration readTimeout = Duration.ofSeconds(15);

    @Bean
    public RestClient vortexRestClient() {
        log.info("Creating Vortex RestClient: baseUrl={}, apiKey={}", baseUrl, maskApiKey(apiKey));
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return RestClient.builder().baseUrl(baseUrl).requestFactory(requestFactory).build();
    }

    private String maskApiKey(String key) {
        if (key == null || key.length() < 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }
}
