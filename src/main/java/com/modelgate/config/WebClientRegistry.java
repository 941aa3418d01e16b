package com.modelgate.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime cache of {@link WebClient} instances keyed by the base URL they were built for.
 * Clients are created lazily on first use and shared by every caller with the same settings.
 */
@Slf4j
@Component
public class WebClientRegistry {

    private final WebClient.Builder webClientBuilder;
    private final Map<String, WebClient> clients = new ConcurrentHashMap<>();

    public WebClientRegistry(WebClient.Builder webClientBuilder) {
        this.webClientBuilder = webClientBuilder;
    }

    public WebClient forBaseUrl(String baseUrl) {
        return clients.computeIfAbsent(fingerprint(baseUrl), key -> {
            log.debug("Creating WebClient for {}", key);
            // the shared builder is mutable, so work on a copy
            return webClientBuilder.clone().baseUrl(key).build();
        });
    }

    int size() {
        return clients.size();
    }

    private static String fingerprint(String baseUrl) {
        String trimmed = baseUrl.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
