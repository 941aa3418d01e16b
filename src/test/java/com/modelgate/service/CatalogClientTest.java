package com.modelgate.service;

import com.modelgate.config.GatewayProperties;
import com.modelgate.config.WebClientRegistry;
import com.modelgate.exception.CatalogFetchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for CatalogClient with a stubbed exchange function.
 */
class CatalogClientTest {

    private static final String LISTING = "{\"data\":[{\"id\":\"vendor/free\",\"name\":\"Free\","
            + "\"pricing\":{\"prompt\":\"0\",\"completion\":\"0\"},\"context_length\":4096,"
            + "\"architecture\":{\"modality\":\"text->text\",\"input_modalities\":[\"text\"]},"
            + "\"top_provider\":{\"max_completion_tokens\":1024,\"is_moderated\":false},"
            + "\"supported_parameters\":[\"temperature\"],\"unknown_field\":1}]}";

    private GatewayProperties properties;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getCatalog().setBaseUrl("https://catalog.example.com/api/v1/");
    }

    @Test
    void fetchModels_DecodesListing() {
        AtomicReference<String> requestedUrl = new AtomicReference<>();
        CatalogClient client = client(request -> {
            requestedUrl.set(request.url().toString());
            return Mono.just(json(HttpStatus.OK, LISTING));
        });

        StepVerifier.create(client.fetchModels())
                .assertNext(models -> {
                    assertEquals(1, models.size());
                    assertEquals("vendor/free", models.get(0).getId());
                    assertEquals(4096, models.get(0).getContextLength());
                    assertEquals(1024, models.get(0).getTopProvider().getMaxCompletionTokens());
                    assertEquals("0", models.get(0).getPricing().getCompletion());
                })
                .verifyComplete();
        assertEquals("https://catalog.example.com/api/v1/models", requestedUrl.get());
    }

    @Test
    void fetchModels_MissingDataIsEmpty() {
        CatalogClient client = client(request -> Mono.just(json(HttpStatus.OK, "{}")));

        StepVerifier.create(client.fetchModels())
                .assertNext(models -> assertTrue(models.isEmpty()))
                .verifyComplete();
    }

    @Test
    void fetchModels_HttpErrorCarriesStatus() {
        CatalogClient client = client(request -> Mono.just(json(HttpStatus.SERVICE_UNAVAILABLE, "{}")));

        StepVerifier.create(client.fetchModels())
                .expectErrorSatisfies(error -> {
                    assertTrue(error instanceof CatalogFetchException);
                    assertEquals("Catalog API error: 503", error.getMessage());
                })
                .verify();
    }

    @Test
    void fetchModels_TimesOut() {
        properties.getSync().setFetchTimeout(Duration.ofMillis(50));
        CatalogClient client = client(request -> Mono.never());

        StepVerifier.create(client.fetchModels())
                .expectErrorSatisfies(error -> {
                    assertTrue(error instanceof CatalogFetchException);
                    assertTrue(error.getMessage().contains("timed out after 50 ms"));
                })
                .verify(Duration.ofSeconds(5));
    }

    private CatalogClient client(ExchangeFunction exchangeFunction) {
        WebClientRegistry registry = new WebClientRegistry(WebClient.builder().exchangeFunction(exchangeFunction));
        return new CatalogClient(registry, properties);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
