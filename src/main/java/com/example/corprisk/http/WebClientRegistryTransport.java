package com.example.corprisk.http;

import com.example.corprisk.config.RegistryProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Blocking GET over the shared registry {@link WebClient}. Callers are analyzer worker
 * threads, never the Netty event loop, so {@code block} is safe here.
 */
@Component
public class WebClientRegistryTransport implements RegistryTransport {

    private static final Logger log = LoggerFactory.getLogger(WebClientRegistryTransport.class);

    private final WebClient http;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public WebClientRegistryTransport(@Qualifier("registryHttp") WebClient http,
                                      ObjectMapper mapper,
                                      RegistryProperties properties) {
        this.http = http;
        this.mapper = mapper;
        // slack over the Netty response timeout so that one fires first
        this.timeout = properties.responseTimeout().plusSeconds(5);
    }

    @Override
    public TransportResponse get(String path, Map<String, String> params) throws RegistryTransportException {
        try {
            TransportResponse resp = http.get()
                    .uri(uriBuilder -> {
                        uriBuilder.path(path);
                        params.forEach((name, value) -> uriBuilder.queryParam(name, value));
                        return uriBuilder.build();
                    })
                    .accept(MediaType.APPLICATION_JSON)
                    .exchangeToMono(this::toResponse)
                    .block(timeout);
            if (resp == null) {
                throw new RegistryTransportException("no response for " + path, null);
            }
            return resp;
        } catch (RegistryTransportException e) {
            throw e;
        } catch (RuntimeException e) {
            // WebClientRequestException, ReadTimeoutException, IllegalStateException from block()
            throw new RegistryTransportException(e.toString(), e);
        }
    }

    private Mono<TransportResponse> toResponse(ClientResponse resp) {
        int code = resp.statusCode().value();
        if (code < 200 || code >= 300) {
            return resp.releaseBody().thenReturn(new TransportResponse(code, null));
        }
        return resp.bodyToMono(String.class)
                .map(body -> new TransportResponse(code, parse(body)))
                .defaultIfEmpty(new TransportResponse(code, null));
    }

    private JsonNode parse(String body) {
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            String preview = body.length() > 256 ? body.substring(0, 256) + "..." : body;
            log.warn("Registry returned non-JSON body: {}", preview.replace('\n', ' ').replace('\r', ' '));
            return null;
        }
    }
}
