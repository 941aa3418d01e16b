package com.modelgate.controller;

import com.modelgate.model.dto.Freshness;
import com.modelgate.service.SyncCoordinator;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check endpoints.
 */
@RestController
@RequestMapping
@RequiredArgsConstructor
public class HealthController {

    static final String SERVICE_NAME = "ModelGate";
    static final String VERSION = "1.0.0";

    private final SyncCoordinator syncCoordinator;

    @GetMapping("/")
    public Mono<Map<String, String>> root() {
        return Mono.just(Map.of(
            "service", SERVICE_NAME,
            "version", VERSION
        ));
    }

    /**
     * Service status with the age of the catalog mirror.
     */
    @GetMapping("/api/status")
    public Mono<Map<String, Object>> status() {
        return syncCoordinator.freshness().map(HealthController::describe);
    }

    private static Map<String, Object> describe(Freshness freshness) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("version", VERSION);
        body.put("catalogLastUpdated", freshness.getLastUpdated());
        body.put("catalogAgeMs", freshness.isNeverSynced() ? null : freshness.getAgeMs());
        body.put("catalogFresh", freshness.isFresh());
        body.put("catalogCriticallyStale", freshness.isCriticallyStale());
        return body;
    }
}
