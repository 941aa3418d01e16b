package com.modelgate.controller;

import com.modelgate.model.dto.ModelIdsResponse;
import com.modelgate.model.dto.ModelQuery;
import com.modelgate.model.dto.ModelsResponse;
import com.modelgate.service.CatalogService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Catalog reads. Each call is charged against the caller's quota by the authentication filter.
 * {@code useCase} is a comma-separated list; unknown use cases and sorts are ignored.
 */
@RestController
@RequestMapping("/api/v1/models")
@RequiredArgsConstructor
public class ModelController {

    static final String IDS_CACHE_CONTROL = "public, s-maxage=900";

    private final CatalogService catalogService;

    @GetMapping("/ids")
    public Mono<ResponseEntity<ModelIdsResponse>> listIds(@RequestParam(required = false) String useCase,
                                                          @RequestParam(required = false) String sort,
                                                          @RequestParam(required = false) Integer topN,
                                                          @RequestParam(required = false) Integer limit) {
        return catalogService.listActiveIds(ModelQuery.of(useCase, sort, topN, limit))
                .map(response -> ResponseEntity.ok()
                        .header(HttpHeaders.CACHE_CONTROL, IDS_CACHE_CONTROL)
                        .body(response));
    }

    @GetMapping("/full")
    public Mono<ModelsResponse> listFull(@RequestParam(required = false) String useCase,
                                         @RequestParam(required = false) String sort,
                                         @RequestParam(required = false) Integer topN,
                                         @RequestParam(required = false) Integer limit) {
        return catalogService.listActive(ModelQuery.of(useCase, sort, topN, limit));
    }
}
