package com.modelgate.service;

import com.modelgate.config.GatewayProperties;
import com.modelgate.model.dto.Freshness;
import com.modelgate.model.dto.SkipReason;
import com.modelgate.model.dto.SyncResult;
import com.modelgate.model.dto.SyncTriggerResponse;
import com.modelgate.model.entity.SyncMeta;
import com.modelgate.repository.SyncMetaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a catalog sync should run and runs it under the sync lock.
 *
 * <p>Used by the admin trigger, the scheduler and the read path. Whatever happens inside a run,
 * the lock is released once it was acquired.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncCoordinator {

    private final SyncLock syncLock;
    private final CatalogSyncer catalogSyncer;
    private final SyncMetaRepository syncMetaRepository;
    private final GatewayProperties properties;
    private final Clock clock;

    /**
     * Age of the last successful sync against the configured thresholds.
     */
    public Mono<Freshness> freshness() {
        return syncMetaRepository.findById(SyncMeta.CATALOG_LAST_UPDATED_KEY)
                .map(SyncMeta::getUpdatedAt)
                .map(this::freshnessOf)
                .defaultIfEmpty(freshnessOf(null));
    }

    /**
     * Run a sync unless the data is fresh (and {@code force} is off) or another worker holds the lock.
     */
    public Mono<SyncTriggerResponse> trigger(boolean force) {
        return freshness().flatMap(freshness -> {
            if (!force && freshness.isFresh()) {
                log.debug("Catalog is fresh ({} ms old), skipping sync", freshness.getAgeMs());
                return Mono.just(SyncTriggerResponse.skipped(SkipReason.DATA_FRESH, freshness.getLastUpdated()));
            }
            return runLocked(freshness.getLastUpdated());
        });
    }

    /**
     * Refresh before serving reads, but only once the catalog is critically stale.
     * Never fails: a serving path keeps the existing mirror when the refresh goes wrong.
     */
    public Mono<Freshness> ensureFresh() {
        return freshness().flatMap(freshness -> {
            if (!freshness.isCriticallyStale()) {
                return Mono.just(freshness);
            }
            log.info("Catalog critically stale, syncing before serving");
            return trigger(false)
                    .onErrorResume(error -> {
                        log.error("Read-path sync failed: {}", error.getMessage());
                        return Mono.empty();
                    })
                    .then(freshness());
        });
    }

    private Mono<SyncTriggerResponse> runLocked(LocalDateTime lastUpdated) {
        return syncLock.acquire().flatMap(acquired -> {
            if (!acquired) {
                return Mono.just(SyncTriggerResponse.skipped(SkipReason.SYNC_IN_PROGRESS, lastUpdated));
            }
            long startedAt = clock.millis();
            return Mono.usingWhen(
                            Mono.just(Boolean.TRUE),
                            held -> guardedRun(),
                            held -> syncLock.release(),
                            (held, error) -> syncLock.release(),
                            held -> syncLock.release())
                    .flatMap(result -> freshness().map(after -> SyncTriggerResponse.builder()
                            .skipped(false)
                            .success(result.isSuccessful())
                            .result(result)
                            .durationMs(clock.millis() - startedAt)
                            .lastUpdated(after.getLastUpdated())
                            .build()));
        });
    }

    // A run ends before its lease does, leaving room for the release write.
    private Mono<SyncResult> guardedRun() {
        Duration budget = runBudget();
        return catalogSyncer.run()
                .timeout(budget)
                .onErrorResume(TimeoutException.class, e -> {
                    log.error("Catalog sync exceeded run budget of {} (lock duration {})",
                            budget, properties.getSync().getLockDuration());
                    return Mono.just(SyncResult.failed("Sync timed out after " + budget.toMillis() + " ms"));
                });
    }

    /**
     * Lock duration less one fetch timeout; half the lock duration when the fetch timeout does not fit.
     */
    Duration runBudget() {
        Duration lockDuration = properties.getSync().getLockDuration();
        Duration budget = lockDuration.minus(properties.getSync().getFetchTimeout());
        return budget.compareTo(lockDuration.dividedBy(2)) > 0 ? budget : lockDuration.dividedBy(2);
    }

    private Freshness freshnessOf(LocalDateTime lastUpdated) {
        if (lastUpdated == null) {
            return Freshness.builder()
                    .ageMs(Long.MAX_VALUE)
                    .fresh(false)
                    .criticallyStale(true)
                    .build();
        }
        long ageMs = Math.max(0, Duration.between(lastUpdated, LocalDateTime.now(clock)).toMillis());
        GatewayProperties.Sync sync = properties.getSync();
        return Freshness.builder()
                .lastUpdated(lastUpdated)
                .ageMs(ageMs)
                .fresh(ageMs < sync.getFreshThreshold().toMillis())
                .criticallyStale(ageMs >= sync.getCriticalThreshold().toMillis())
                .build();
    }
}
