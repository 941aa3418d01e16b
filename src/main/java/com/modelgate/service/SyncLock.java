package com.modelgate.service;

import com.modelgate.config.GatewayProperties;
import com.modelgate.model.entity.SyncMeta;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Database-row mutex guarding catalog syncs, with lease expiry.
 *
 * <p>The lease is held while the row says {@code true} and was touched less than
 * {@code lockDuration} ago. An older lease belongs to a crashed holder and can be taken over, so
 * a lost release delays the next sync by at most one lock duration.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncLock {

    private static final String TAKE_SQL = "UPDATE sync_meta SET meta_value = 'true', updated_at = :now "
            + "WHERE meta_key = :key AND (meta_value IS NULL OR meta_value <> 'true' "
            + "OR updated_at IS NULL OR updated_at <= :staleBefore)";

    private static final String CREATE_SQL = "INSERT INTO sync_meta (meta_key, meta_value, updated_at) "
            + "VALUES (:key, 'true', :now)";

    private static final String RELEASE_SQL = "UPDATE sync_meta SET meta_value = 'false', updated_at = :now "
            + "WHERE meta_key = :key";

    private final DatabaseClient databaseClient;
    private final GatewayProperties properties;
    private final Clock clock;

    /**
     * Try to take the lease.
     *
     * @return true when this caller now holds the lock, false when another worker holds a live lease
     */
    public Mono<Boolean> acquire() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime staleBefore = now.minus(properties.getSync().getLockDuration());

        return databaseClient.sql(TAKE_SQL)
                .bind("now", now)
                .bind("key", SyncMeta.SYNC_LOCK_KEY)
                .bind("staleBefore", staleBefore)
                .fetch()
                .rowsUpdated()
                .flatMap(updated -> updated > 0 ? Mono.just(true) : create(now))
                .doOnNext(acquired -> {
                    if (acquired) {
                        log.debug("Sync lock acquired at {}", now);
                    } else {
                        log.info("Sync lock held by another worker");
                    }
                });
    }

    /**
     * Release the lease unconditionally.
     */
    public Mono<Void> release() {
        return databaseClient.sql(RELEASE_SQL)
                .bind("now", LocalDateTime.now(clock))
                .bind("key", SyncMeta.SYNC_LOCK_KEY)
                .fetch()
                .rowsUpdated()
                .doOnNext(updated -> log.debug("Sync lock released"))
                .then();
    }

    // Nothing matched: either the row does not exist yet or a live lease is held.
    private Mono<Boolean> create(LocalDateTime now) {
        return databaseClient.sql(CREATE_SQL)
                .bind("key", SyncMeta.SYNC_LOCK_KEY)
                .bind("now", now)
                .fetch()
                .rowsUpdated()
                .map(inserted -> inserted > 0)
                .onErrorResume(DataIntegrityViolationException.class, e -> Mono.just(false));
    }
}
