package com.modelgate.service;

import com.modelgate.config.GatewayProperties;
import com.modelgate.config.WebClientRegistry;
import com.modelgate.exception.CatalogFetchException;
import com.modelgate.model.dto.UpstreamListing;
import com.modelgate.model.dto.UpstreamModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Client for the upstream model listing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogClient {

    private static final String MODELS_PATH = "/models";

    private final WebClientRegistry webClientRegistry;
    private final GatewayProperties properties;

    /**
     * Fetch every model the upstream currently lists, bounded by the configured fetch timeout.
     *
     * @return listed models, empty when the document has no {@code data}
     * @throws CatalogFetchException (as error signal) on HTTP failure, timeout or undecodable body
     */
    public Mono<List<UpstreamModel>> fetchModels() {
        String baseUrl = properties.getCatalog().getBaseUrl();
        Duration timeout = properties.getSync().getFetchTimeout();

        return webClientRegistry.forBaseUrl(baseUrl)
                .get()
                .uri(MODELS_PATH)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(UpstreamListing.class)
                .map(listing -> listing.getData() != null ? listing.getData() : Collections.<UpstreamModel>emptyList())
                .defaultIfEmpty(Collections.emptyList())
                .timeout(timeout)
                .onErrorMap(error -> !(error instanceof CatalogFetchException), this::toFetchException)
                .doOnError(error -> log.warn("Catalog fetch from {} failed: {}", baseUrl, error.getMessage()));
    }

    private CatalogFetchException toFetchException(Throwable error) {
        if (error instanceof TimeoutException) {
            return new CatalogFetchException("Catalog API timed out after "
                    + properties.getSync().getFetchTimeout().toMillis() + " ms", error);
        }
        if (error instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) error;
            return new CatalogFetchException("Catalog API error: " + response.getStatusCode().value(), error);
        }
        return new CatalogFetchException("Catalog API request failed: " + error.getMessage(), error);
    }
}
