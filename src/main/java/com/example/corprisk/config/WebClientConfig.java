package com.example.corprisk.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.nio.charset.StandardCharsets;

@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Bean("registryHttp")
    public WebClient registryHttp(RegistryProperties properties) {
        HttpClient http = HttpClient.create()
                .followRedirect(true)
                .responseTimeout(properties.responseTimeout())
                .httpResponseDecoder(h -> h
                        .maxHeaderSize(64 * 1024)
                        .maxInitialLineLength(8 * 1024));

        String apiKey = properties.apiKey() == null ? "" : properties.apiKey().trim();
        if (apiKey.isBlank()) {
            log.warn("registry.api-key is not set; upstream calls will be rejected with 401");
        }

        return WebClient.builder()
                .baseUrl(properties.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(c -> c.defaultCodecs().maxInMemorySize(8 * 1024 * 1024))
                        .build())
                // registry basic auth: key as username, empty password
                .defaultHeaders(h -> h.setBasicAuth(apiKey, "", StandardCharsets.UTF_8))
                .defaultHeader(HttpHeaders.ACCEPT, "application/json")
                .build();
    }
}
