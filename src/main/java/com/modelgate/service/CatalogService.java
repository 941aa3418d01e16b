package com.modelgate.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelgate.model.dto.ModelIdsResponse;
import com.modelgate.model.dto.ModelQuery;
import com.modelgate.model.dto.ModelResponse;
import com.modelgate.model.dto.ModelsResponse;
import com.modelgate.model.dto.UseCase;
import com.modelgate.model.entity.CatalogEntry;
import com.modelgate.repository.CatalogEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;

/**
 * Read side of the catalog mirror. Serves active entries only, refreshing first when critically stale.
 * Entries are filtered by use case, sorted, then truncated to {@code topN} and {@code limit}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogService {

    static final int MAX_LIMIT = 100;

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final CatalogEntryRepository catalogEntryRepository;
    private final SyncCoordinator syncCoordinator;
    private final ObjectMapper objectMapper;

    public Mono<ModelIdsResponse> listActiveIds(ModelQuery query) {
        return syncCoordinator.ensureFresh()
                .then(select(query)
                        .map(ModelResponse::getId)
                        .collectList())
                .map(ids -> ModelIdsResponse.builder()
                        .ids(ids)
                        .count(ids.size())
                        .build());
    }

    public Mono<ModelsResponse> listActive(ModelQuery query) {
        return syncCoordinator.ensureFresh()
                .flatMap(freshness -> select(query)
                        .collectList()
                        .map(models -> ModelsResponse.builder()
                                .models(models)
                                .lastUpdated(freshness.getLastUpdated())
                                .count(models.size())
                                .build()));
    }

    /**
     * Limit clamped to 1..{@value #MAX_LIMIT}.
     */
    static int clamp(int limit) {
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    /**
     * Smallest of the clamped {@code topN} and {@code limit}, or null when neither is given.
     */
    static Integer cap(ModelQuery query) {
        Integer topN = query.getTopN() != null ? clamp(query.getTopN()) : null;
        Integer limit = query.getLimit() != null ? clamp(query.getLimit()) : null;
        if (topN == null) {
            return limit;
        }
        return limit == null ? topN : Math.min(topN, limit);
    }

    private Flux<ModelResponse> select(ModelQuery query) {
        Set<UseCase> useCases = query.getUseCases();
        Flux<ModelResponse> models = catalogEntryRepository.findActive()
                .map(this::toResponse)
                .filter(model -> useCases.stream().allMatch(useCase -> useCase.matches(model)))
                .sort(query.getSort().comparator());
        Integer cap = cap(query);
        return cap != null ? models.take(cap) : models;
    }

    private ModelResponse toResponse(CatalogEntry entry) {
        return ModelResponse.builder()
                .id(entry.getId())
                .name(entry.getName())
                .description(entry.getDescription())
                .contextLength(entry.getContextLength())
                .maxCompletionTokens(entry.getMaxCompletionTokens())
                .modality(entry.getModality())
                .inputModalities(fromJson(entry.getInputModalities()))
                .outputModalities(fromJson(entry.getOutputModalities()))
                .supportedParameters(fromJson(entry.getSupportedParameters()))
                .isModerated(entry.getModerated())
                .createdAt(entry.getCreatedAt())
                .build();
    }

    private List<String> fromJson(String json) {
        if (json == null || json.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse stored catalog attribute: {}", json, e);
            return null;
        }
    }
}
