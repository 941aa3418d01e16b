package com.modelgate.service;

import com.modelgate.config.GatewayProperties;
import com.modelgate.model.entity.SyncMeta;
import com.modelgate.support.H2TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Store-level tests for SyncLock against in-memory H2.
 */
class SyncLockTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final LocalDateTime NOW_LOCAL = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);

    private H2TestDatabase database;
    private SyncLock syncLock;

    @BeforeEach
    void setUp() {
        database = new H2TestDatabase();
        syncLock = new SyncLock(database.databaseClient(), new GatewayProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void acquire_NoRowThenSecondAttemptFails() {
        StepVerifier.create(syncLock.acquire())
                .expectNext(true)
                .verifyComplete();

        StepVerifier.create(syncLock.acquire())
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void acquire_AfterReleaseSucceeds() {
        StepVerifier.create(syncLock.acquire().then(syncLock.release()).then(syncLock.acquire()))
                .expectNext(true)
                .verifyComplete();

        assertEquals("true", database.queryString(
                "SELECT meta_value FROM sync_meta WHERE meta_key = '" + SyncMeta.SYNC_LOCK_KEY + "'"));
    }

    @Test
    void acquire_StaleLeaseIsTakenOver() {
        database.insertSyncMeta(SyncMeta.SYNC_LOCK_KEY, "true", NOW_LOCAL.minusMinutes(6));

        StepVerifier.create(syncLock.acquire())
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    void acquire_LiveLeaseIsRespected() {
        database.insertSyncMeta(SyncMeta.SYNC_LOCK_KEY, "true", NOW_LOCAL.minusMinutes(4));

        StepVerifier.create(syncLock.acquire())
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void release_MarksRowFree() {
        database.insertSyncMeta(SyncMeta.SYNC_LOCK_KEY, "true", NOW_LOCAL);

        StepVerifier.create(syncLock.release())
                .verifyComplete();

        assertEquals("false", database.queryString(
                "SELECT meta_value FROM sync_meta WHERE meta_key = '" + SyncMeta.SYNC_LOCK_KEY + "'"));
    }

    @Test
    void acquire_ConcurrentCallersExactlyOneWins() throws Exception {
        database.insertSyncMeta(SyncMeta.SYNC_LOCK_KEY, "false", NOW_LOCAL.minusHours(1));
        int callers = 10;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(callers);
        AtomicInteger winners = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();

        try {
            for (int i = 0; i < callers; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        if (Boolean.TRUE.equals(syncLock.acquire().block(Duration.ofSeconds(30)))) {
                            winners.incrementAndGet();
                        }
                    } catch (Exception e) {
                        failed.incrementAndGet();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(60, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(0, failed.get());
        assertEquals(1, winners.get());
    }
}
