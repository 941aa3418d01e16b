package com.modelgate.service;

import com.modelgate.config.GatewayProperties;
import com.modelgate.exception.ResourceNotFoundException;
import com.modelgate.model.dto.QuotaOutcome;
import io.r2dbc.spi.Row;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Per-principal sliding-window request quota.
 *
 * <p>Admission is decided by a single conditional {@code UPDATE} evaluated against the current row
 * under the row lock: the window check, the new count and the admission predicate are all part of
 * that one statement, so concurrent callers on any number of instances can never push a principal
 * past its limit. The admitted row is read back in the same transaction while the lock is still
 * held. A rejected call performs one extra read that only feeds response metadata.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuotaLedger {

    private static final String WINDOW_EXPIRED =
            "(last_request IS NULL OR :now - last_request >= COALESCE(rate_limit_time_window, :defaultWindow))";

    static final String CONSUME_SQL = "UPDATE principals SET "
            + "request_count = CASE WHEN " + WINDOW_EXPIRED + " THEN 1 ELSE request_count + 1 END, "
            + "remaining = CASE WHEN " + WINDOW_EXPIRED
            + " THEN GREATEST(COALESCE(rate_limit_max, :defaultMax) - 1, 0)"
            + " ELSE GREATEST(COALESCE(rate_limit_max, :defaultMax) - (request_count + 1), 0) END, "
            + "last_request = :now "
            + "WHERE id = :id AND (" + WINDOW_EXPIRED
            + " OR request_count < COALESCE(rate_limit_max, :defaultMax))";

    private static final String READ_SQL = "SELECT request_count, remaining, last_request, "
            + "COALESCE(rate_limit_max, :defaultMax) AS effective_max, "
            + "COALESCE(rate_limit_time_window, :defaultWindow) AS effective_window "
            + "FROM principals WHERE id = :id";

    private final DatabaseClient databaseClient;
    private final TransactionalOperator transactionalOperator;
    private final GatewayProperties properties;
    private final Clock clock;

    /**
     * Charge one request against the principal's quota.
     *
     * @param principalId Principal to charge
     * @return accepted outcome with the new state, or a rejected outcome with best-effort metadata
     */
    public Mono<QuotaOutcome> consume(String principalId) {
        long now = clock.millis();

        Mono<QuotaOutcome> admitted = databaseClient.sql(CONSUME_SQL)
                .bind("now", now)
                .bind("defaultWindow", defaultWindowMs())
                .bind("defaultMax", defaultMax())
                .bind("id", principalId)
                .fetch()
                .rowsUpdated()
                .filter(updated -> updated > 0)
                .flatMap(updated -> readRow(principalId))
                .map(row -> row.toOutcome(true))
                .as(transactionalOperator::transactional);

        return admitted.switchIfEmpty(Mono.defer(() -> diagnose(principalId)));
    }

    /**
     * Current quota state without charging. Once the window has elapsed the full limit is reported.
     */
    public Mono<QuotaOutcome> status(String principalId) {
        long now = clock.millis();
        return readRow(principalId)
                .map(row -> row.windowExpiredAt(now) ? row.reset().toOutcome(true) : row.toOutcome(true))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Principal", principalId)));
    }

    // Not atomic with the rejected update; only used to fill in response headers.
    private Mono<QuotaOutcome> diagnose(String principalId) {
        return readRow(principalId)
                .map(row -> {
                    log.debug("Quota exhausted for principal {} ({} of {})",
                            principalId, row.getRequestCount(), row.getLimit());
                    return row.toOutcome(false);
                })
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Principal", principalId)));
    }

    private Mono<LedgerRow> readRow(String principalId) {
        return databaseClient.sql(READ_SQL)
                .bind("defaultMax", defaultMax())
                .bind("defaultWindow", defaultWindowMs())
                .bind("id", principalId)
                .map((row, metadata) -> toLedgerRow(row))
                .one();
    }

    private LedgerRow toLedgerRow(Row row) {
        Integer requestCount = row.get("request_count", Integer.class);
        Integer remaining = row.get("remaining", Integer.class);
        return new LedgerRow(
                requestCount != null ? requestCount : 0,
                remaining != null ? remaining : 0,
                row.get("last_request", Long.class),
                row.get("effective_max", Integer.class),
                row.get("effective_window", Long.class));
    }

    private int defaultMax() {
        return properties.getRateLimit().getDefaultMax();
    }

    private long defaultWindowMs() {
        return properties.getRateLimit().getDefaultTimeWindow().toMillis();
    }

    @Value
    static class LedgerRow {
        int requestCount;
        int remaining;
        Long lastRequest;
        int limit;
        long windowMs;

        boolean windowExpiredAt(long now) {
            return lastRequest == null || now - lastRequest >= windowMs;
        }

        LedgerRow reset() {
            return new LedgerRow(0, limit, lastRequest, limit, windowMs);
        }

        QuotaOutcome toOutcome(boolean accepted) {
            return QuotaOutcome.builder()
                    .accepted(accepted)
                    .remaining(accepted ? remaining : 0)
                    .limit(limit)
                    .lastRequest(lastRequest != null ? Instant.ofEpochMilli(lastRequest) : null)
                    .windowMs(windowMs)
                    .requestCount(requestCount)
                    .build();
        }
    }
}
