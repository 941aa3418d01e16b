package com.modelgate.service;

import com.modelgate.config.GatewayProperties;
import com.modelgate.model.dto.SkipReason;
import com.modelgate.model.dto.SyncResult;
import com.modelgate.model.entity.SyncMeta;
import com.modelgate.repository.SyncMetaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for SyncCoordinator.
 */
@ExtendWith(MockitoExtension.class)
class SyncCoordinatorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final LocalDateTime NOW_LOCAL = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private SyncLock syncLock;

    @Mock
    private CatalogSyncer catalogSyncer;

    @Mock
    private SyncMetaRepository syncMetaRepository;

    private GatewayProperties properties;
    private SyncCoordinator coordinator;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        coordinator = new SyncCoordinator(syncLock, catalogSyncer, syncMetaRepository, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void freshness_NeverSynced() {
        when(syncMetaRepository.findById(SyncMeta.CATALOG_LAST_UPDATED_KEY)).thenReturn(Mono.empty());

        StepVerifier.create(coordinator.freshness())
                .assertNext(freshness -> {
                    assertTrue(freshness.isNeverSynced());
                    assertEquals(Long.MAX_VALUE, freshness.getAgeMs());
                    assertFalse(freshness.isFresh());
                    assertTrue(freshness.isCriticallyStale());
                })
                .verifyComplete();
    }

    @Test
    void trigger_FreshDataIsSkipped() {
        lastUpdated(NOW_LOCAL.minusMinutes(10));

        StepVerifier.create(coordinator.trigger(false))
                .assertNext(response -> {
                    assertTrue(response.wasSkipped());
                    assertEquals(SkipReason.DATA_FRESH, response.getReason());
                    assertEquals(NOW_LOCAL.minusMinutes(10), response.getLastUpdated());
                })
                .verifyComplete();
        verify(syncLock, never()).acquire();
    }

    @Test
    void trigger_ForceIgnoresFreshness() {
        lastUpdated(NOW_LOCAL.minusMinutes(10));
        when(syncLock.acquire()).thenReturn(Mono.just(true));
        when(syncLock.release()).thenReturn(Mono.empty());
        when(catalogSyncer.run()).thenReturn(Mono.just(SyncResult.builder().totalFetched(3).qualifying(2).build()));

        StepVerifier.create(coordinator.trigger(true))
                .assertNext(response -> {
                    assertFalse(response.wasSkipped());
                    assertTrue(response.getSuccess());
                    assertEquals(2, response.getResult().getQualifying());
                })
                .verifyComplete();
        verify(syncLock).release();
    }

    @Test
    void trigger_LockHeldElsewhere() {
        lastUpdated(NOW_LOCAL.minusHours(3));
        when(syncLock.acquire()).thenReturn(Mono.just(false));

        StepVerifier.create(coordinator.trigger(false))
                .assertNext(response -> {
                    assertTrue(response.wasSkipped());
                    assertEquals(SkipReason.SYNC_IN_PROGRESS, response.getReason());
                })
                .verifyComplete();
        verify(catalogSyncer, never()).run();
        verify(syncLock, never()).release();
    }

    @Test
    void trigger_FailedRunStillReleases() {
        lastUpdated(NOW_LOCAL.minusHours(3));
        when(syncLock.acquire()).thenReturn(Mono.just(true));
        when(syncLock.release()).thenReturn(Mono.empty());
        when(catalogSyncer.run()).thenReturn(Mono.just(SyncResult.failed("Catalog API error: 500")));

        StepVerifier.create(coordinator.trigger(false))
                .assertNext(response -> {
                    assertFalse(response.getSuccess());
                    assertEquals("Catalog API error: 500", response.getResult().getError());
                })
                .verifyComplete();
        verify(syncLock).release();
    }

    @Test
    void trigger_UnexpectedErrorStillReleases() {
        lastUpdated(NOW_LOCAL.minusHours(3));
        AtomicBoolean released = new AtomicBoolean();
        when(syncLock.acquire()).thenReturn(Mono.just(true));
        when(syncLock.release()).thenReturn(Mono.fromRunnable(() -> released.set(true)));
        when(catalogSyncer.run()).thenReturn(Mono.error(new IllegalStateException("boom")));

        StepVerifier.create(coordinator.trigger(false))
                .expectError(IllegalStateException.class)
                .verify();
        assertTrue(released.get());
    }

    @Test
    void runBudget_StaysBelowLockDuration() {
        properties.getSync().setLockDuration(Duration.ofMinutes(5));
        properties.getSync().setFetchTimeout(Duration.ofSeconds(8));
        assertEquals(Duration.ofSeconds(292), coordinator.runBudget());

        properties.getSync().setFetchTimeout(Duration.ofMinutes(10));
        assertEquals(Duration.ofSeconds(150), coordinator.runBudget());
    }

    @Test
    void trigger_RunLongerThanLeaseTimesOut() {
        properties.getSync().setLockDuration(Duration.ofMillis(60));
        properties.getSync().setFetchTimeout(Duration.ofMillis(20));
        lastUpdated(NOW_LOCAL.minusHours(3));
        when(syncLock.acquire()).thenReturn(Mono.just(true));
        when(syncLock.release()).thenReturn(Mono.empty());
        when(catalogSyncer.run()).thenReturn(Mono.never());

        StepVerifier.create(coordinator.trigger(false))
                .assertNext(response -> {
                    assertFalse(response.getSuccess());
                    assertEquals("Sync timed out after 40 ms", response.getResult().getError());
                })
                .verifyComplete();
        verify(syncLock).release();
    }

    @Test
    void ensureFresh_StaleButNotCriticalServesAsIs() {
        lastUpdated(NOW_LOCAL.minusMinutes(90));

        StepVerifier.create(coordinator.ensureFresh())
                .assertNext(freshness -> {
                    assertFalse(freshness.isFresh());
                    assertFalse(freshness.isCriticallyStale());
                })
                .verifyComplete();
        verify(syncLock, never()).acquire();
    }

    @Test
    void ensureFresh_CriticallyStaleSyncs() {
        lastUpdated(NOW_LOCAL.minusHours(3));
        when(syncLock.acquire()).thenReturn(Mono.just(true));
        when(syncLock.release()).thenReturn(Mono.empty());
        when(catalogSyncer.run()).thenReturn(Mono.just(SyncResult.builder().build()));

        StepVerifier.create(coordinator.ensureFresh())
                .expectNextCount(1)
                .verifyComplete();
        verify(catalogSyncer).run();
    }

    private void lastUpdated(LocalDateTime at) {
        when(syncMetaRepository.findById(SyncMeta.CATALOG_LAST_UPDATED_KEY))
                .thenReturn(Mono.just(SyncMeta.builder()
                        .key(SyncMeta.CATALOG_LAST_UPDATED_KEY)
                        .value(at.toString())
                        .updatedAt(at)
                        .build()));
    }
}
