package com.modelgate.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic catalog refresh. Skips itself while data is fresh, so the interval is an upper bound on staleness.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "modelgate.sync", name = "scheduler-enabled", havingValue = "true",
        matchIfMissing = true)
public class SyncScheduler {

    private final SyncCoordinator syncCoordinator;

    @Scheduled(initialDelayString = "${modelgate.sync.initial-delay:PT30S}",
            fixedDelayString = "${modelgate.sync.interval:PT1H}")
    public void refresh() {
        syncCoordinator.trigger(false)
                .doOnNext(response -> {
                    if (response.wasSkipped()) {
                        log.debug("Scheduled sync skipped: {}", response.getReason().getValue());
                    } else {
                        log.info("Scheduled sync finished: success={}, durationMs={}",
                                response.getSuccess(), response.getDurationMs());
                    }
                })
                .doOnError(error -> log.error("Scheduled sync failed: {}", error.getMessage(), error))
                .onErrorComplete()
                .block();
    }
}
