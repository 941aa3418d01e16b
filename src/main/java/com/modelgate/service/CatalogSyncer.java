package com.modelgate.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelgate.model.dto.SyncResult;
import com.modelgate.model.dto.UpstreamModel;
import com.modelgate.model.entity.SyncMeta;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Mirrors the free subset of the upstream listing into {@code catalog_entries}.
 *
 * <p>A run never throws: failures are reported in {@link SyncResult#getError()} so that the caller's
 * lock release always executes. A failed fetch leaves stored data untouched.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogSyncer {

    /** Absent entries are only deactivated when at least this share of the active set was seen. */
    static final double DEACTIVATION_MIN_SEEN_RATIO = 0.5;

    private static final double UNKNOWN_PRICE = 999;

    private static final String INSERT_SQL = "INSERT INTO catalog_entries (id, name, description, context_length, "
            + "max_completion_tokens, modality, input_modalities, output_modalities, supported_parameters, "
            + "is_moderated, is_active, last_seen_at, created_at) VALUES (:id, :name, :description, :contextLength, "
            + ":maxCompletionTokens, :modality, :inputModalities, :outputModalities, :supportedParameters, "
            + ":moderated, TRUE, :now, :now)";

    private static final String UPDATE_SQL = "UPDATE catalog_entries SET name = :name, description = :description, "
            + "context_length = :contextLength, max_completion_tokens = :maxCompletionTokens, modality = :modality, "
            + "input_modalities = :inputModalities, output_modalities = :outputModalities, "
            + "supported_parameters = :supportedParameters, is_moderated = :moderated, is_active = TRUE, "
            + "last_seen_at = :now WHERE id = :id";

    private static final String DEACTIVATE_SQL = "UPDATE catalog_entries SET is_active = FALSE "
            + "WHERE is_active = TRUE AND id NOT IN (:seenIds)";

    private static final String TOUCH_META_SQL = "UPDATE sync_meta SET meta_value = :value, updated_at = :now "
            + "WHERE meta_key = :key";

    private static final String CREATE_META_SQL = "INSERT INTO sync_meta (meta_key, meta_value, updated_at) "
            + "VALUES (:key, :value, :now)";

    private final CatalogClient catalogClient;
    private final DatabaseClient databaseClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Run one sync cycle.
     *
     * @return counters of the cycle, with {@code error} set when it failed
     */
    public Mono<SyncResult> run() {
        LocalDateTime now = LocalDateTime.now(clock);

        return catalogClient.fetchModels()
                .flatMap(models -> apply(models, now))
                .onErrorResume(error -> {
                    log.error("Catalog sync failed: {}", error.getMessage(), error);
                    return Mono.just(SyncResult.failed(
                            error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName()));
                });
    }

    /**
     * Free models only: both prompt and completion price parse to zero.
     * Missing or unparsable prices count as paid.
     */
    static boolean isFree(UpstreamModel model) {
        UpstreamModel.Pricing pricing = model.getPricing();
        if (pricing == null) {
            return false;
        }
        return price(pricing.getPrompt()) == 0 && price(pricing.getCompletion()) == 0;
    }

    /**
     * Whether absent entries may be deactivated after seeing {@code seenCount} of them.
     * Guards against a truncated upstream response wiping the active catalog.
     */
    static boolean deactivationAllowed(int seenCount, long previouslyActive) {
        return previouslyActive == 0 || seenCount >= previouslyActive * DEACTIVATION_MIN_SEEN_RATIO;
    }

    private Mono<SyncResult> apply(List<UpstreamModel> models, LocalDateTime now) {
        Map<String, UpstreamModel> qualifying = new LinkedHashMap<>();
        for (UpstreamModel model : models) {
            if (model.getId() != null && isFree(model)) {
                qualifying.putIfAbsent(model.getId(), model);
            }
        }
        List<String> seenIds = new ArrayList<>(qualifying.keySet());

        return Mono.zip(existingIds(), countActive())
                .flatMap(state -> {
                    Set<String> existing = state.getT1();
                    long previouslyActive = state.getT2();

                    return Flux.fromIterable(qualifying.values())
                            .concatMap(model -> existing.contains(model.getId())
                                    ? update(model, now).thenReturn(false)
                                    : insert(model, now).thenReturn(true))
                            .collectList()
                            .flatMap(insertedFlags -> {
                                int inserted = (int) insertedFlags.stream().filter(Boolean::booleanValue).count();
                                SyncResult.SyncResultBuilder result = SyncResult.builder()
                                        .totalFetched(models.size())
                                        .qualifying(seenIds.size())
                                        .inserted(inserted)
                                        .updated(insertedFlags.size() - inserted);

                                return deactivateAbsent(seenIds, previouslyActive)
                                        .flatMap(deactivated -> touchLastUpdated(now)
                                                .thenReturn(result.deactivated(deactivated).build()));
                            });
                })
                .doOnNext(result -> log.info("Catalog sync done: fetched={}, qualifying={}, inserted={}, updated={}, "
                                + "deactivated={}", result.getTotalFetched(), result.getQualifying(),
                        result.getInserted(), result.getUpdated(), result.getDeactivated()));
    }

    private Mono<Integer> deactivateAbsent(List<String> seenIds, long previouslyActive) {
        if (!deactivationAllowed(seenIds.size(), previouslyActive)) {
            log.warn("Skipping deactivation: saw {} entries but {} were active", seenIds.size(), previouslyActive);
            return Mono.just(0);
        }
        if (seenIds.isEmpty()) {
            return Mono.just(0);
        }
        return databaseClient.sql(DEACTIVATE_SQL)
                .bind("seenIds", seenIds)
                .fetch()
                .rowsUpdated()
                .map(Long::intValue);
    }

    private Mono<Set<String>> existingIds() {
        return databaseClient.sql("SELECT id FROM catalog_entries")
                .map((row, metadata) -> row.get("id", String.class))
                .all()
                .collect(Collectors.toSet());
    }

    private Mono<Long> countActive() {
        return databaseClient.sql("SELECT COUNT(*) AS active_count FROM catalog_entries WHERE is_active = TRUE")
                .map((row, metadata) -> row.get("active_count", Long.class))
                .one()
                .defaultIfEmpty(0L);
    }

    private Mono<Long> insert(UpstreamModel model, LocalDateTime now) {
        return bindAttributes(databaseClient.sql(INSERT_SQL), model, now).fetch().rowsUpdated();
    }

    private Mono<Long> update(UpstreamModel model, LocalDateTime now) {
        return bindAttributes(databaseClient.sql(UPDATE_SQL), model, now).fetch().rowsUpdated();
    }

    private GenericExecuteSpec bindAttributes(GenericExecuteSpec spec, UpstreamModel model, LocalDateTime now) {
        UpstreamModel.Architecture architecture = model.getArchitecture();
        UpstreamModel.TopProvider topProvider = model.getTopProvider();

        spec = spec.bind("id", model.getId())
                .bind("name", model.getName() != null ? model.getName() : model.getId())
                .bind("now", now);
        spec = bindNullable(spec, "description", model.getDescription(), String.class);
        spec = bindNullable(spec, "contextLength", model.getContextLength(), Integer.class);
        spec = bindNullable(spec, "maxCompletionTokens",
                topProvider != null ? topProvider.getMaxCompletionTokens() : null, Integer.class);
        spec = bindNullable(spec, "modality", architecture != null ? architecture.getModality() : null, String.class);
        spec = bindNullable(spec, "inputModalities",
                toJson(architecture != null ? architecture.getInputModalities() : null), String.class);
        spec = bindNullable(spec, "outputModalities",
                toJson(architecture != null ? architecture.getOutputModalities() : null), String.class);
        spec = bindNullable(spec, "supportedParameters", toJson(model.getSupportedParameters()), String.class);
        spec = bindNullable(spec, "moderated", topProvider != null ? topProvider.getModerated() : null, Boolean.class);
        return spec;
    }

    private Mono<Void> touchLastUpdated(LocalDateTime now) {
        String value = now.toString();
        return databaseClient.sql(TOUCH_META_SQL)
                .bind("value", value)
                .bind("now", now)
                .bind("key", SyncMeta.CATALOG_LAST_UPDATED_KEY)
                .fetch()
                .rowsUpdated()
                .flatMap(updated -> updated > 0 ? Mono.just(updated) : databaseClient.sql(CREATE_META_SQL)
                        .bind("key", SyncMeta.CATALOG_LAST_UPDATED_KEY)
                        .bind("value", value)
                        .bind("now", now)
                        .fetch()
                        .rowsUpdated())
                .then();
    }

    private String toJson(List<String> values) {
        if (values == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize catalog attribute", e);
            return null;
        }
    }

    private static GenericExecuteSpec bindNullable(GenericExecuteSpec spec, String name, Object value, Class<?> type) {
        return value != null ? spec.bind(name, value) : spec.bindNull(name, type);
    }

    private static double price(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN_PRICE;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return UNKNOWN_PRICE;
        }
    }
}
