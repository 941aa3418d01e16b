package com.modelgate.controller;

import com.modelgate.exception.GlobalExceptionHandler;
import com.modelgate.model.dto.ModelIdsResponse;
import com.modelgate.model.dto.ModelQuery;
import com.modelgate.model.dto.ModelResponse;
import com.modelgate.model.dto.ModelSort;
import com.modelgate.model.dto.UseCase;
import com.modelgate.model.dto.ModelsResponse;
import com.modelgate.service.CatalogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.EnumSet;
import java.util.List;

import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ModelControllerTest {

    @Mock
    private CatalogService catalogService;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToController(new ModelController(catalogService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void listIds_PassesLimitAndSetsCacheControl() {
        when(catalogService.listActiveIds(ModelQuery.of(null, null, null, 2))).thenReturn(Mono.just(ModelIdsResponse.builder()
                .ids(List.of("vendor/a", "vendor/b"))
                .count(2)
                .build()));

        webTestClient.get()
                .uri("/api/v1/models/ids?limit=2")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals("Cache-Control", "public, s-maxage=900")
                .expectBody()
                .jsonPath("$.count").isEqualTo(2)
                .jsonPath("$.ids[1]").isEqualTo("vendor/b");
    }

    @Test
    void listFull_WithoutLimit() {
        when(catalogService.listActive(ModelQuery.unfiltered())).thenReturn(Mono.just(ModelsResponse.builder()
                .models(List.of(ModelResponse.builder()
                        .id("vendor/a")
                        .name("Model A")
                        .inputModalities(List.of("text"))
                        .isModerated(false)
                        .build()))
                .count(1)
                .build()));

        webTestClient.get()
                .uri("/api/v1/models/full")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(1)
                .jsonPath("$.models[0].id").isEqualTo("vendor/a")
                .jsonPath("$.models[0].inputModalities[0]").isEqualTo("text");
    }

    @Test
    void listFull_ParsesUseCaseSortAndTopN() {
        ModelQuery expected = ModelQuery.builder()
                .useCases(EnumSet.of(UseCase.CHAT, UseCase.TOOLS))
                .sort(ModelSort.NEWEST)
                .topN(5)
                .build();
        when(catalogService.listActive(expected)).thenReturn(Mono.just(ModelsResponse.builder()
                .models(List.of())
                .count(0)
                .build()));

        webTestClient.get()
                .uri("/api/v1/models/full?useCase=chat,tools,bogus&sort=newest&topN=5")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(0);
    }

    @Test
    void listIds_NonNumericLimitIsBadRequest() {
        webTestClient.get()
                .uri("/api/v1/models/ids?limit=lots")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("BAD_REQUEST");
    }
}
