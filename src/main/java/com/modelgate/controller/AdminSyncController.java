package com.modelgate.controller;

import com.modelgate.config.GatewayProperties;
import com.modelgate.model.dto.ErrorResponse;
import com.modelgate.model.dto.SkipReason;
import com.modelgate.model.dto.SyncTriggerResponse;
import com.modelgate.service.SyncCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Manual catalog sync trigger, guarded by a shared admin secret.
 */
@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminSyncController {

    static final String ADMIN_SECRET_HEADER = "X-Admin-Secret";

    private final SyncCoordinator syncCoordinator;
    private final GatewayProperties properties;

    @PostMapping("/sync-models")
    public Mono<ResponseEntity<Object>> syncModels(
            @RequestHeader(value = ADMIN_SECRET_HEADER, required = false) String secret,
            @RequestParam(defaultValue = "false") boolean force) {
        String configured = properties.getAdmin().getSecret();
        if (!StringUtils.hasText(configured)) {
            log.error("Admin sync requested but no admin secret is configured");
            return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR, "Admin secret not configured", "CONFIG_ERROR"));
        }
        if (!matches(configured, secret)) {
            log.warn("Admin sync rejected: bad secret");
            return Mono.just(error(HttpStatus.UNAUTHORIZED, "Unauthorized", "UNAUTHORIZED"));
        }

        return syncCoordinator.trigger(force).map(AdminSyncController::toResponse);
    }

    private static ResponseEntity<Object> toResponse(SyncTriggerResponse response) {
        if (response.wasSkipped()) {
            HttpStatus status = response.getReason() == SkipReason.SYNC_IN_PROGRESS
                    ? HttpStatus.CONFLICT : HttpStatus.OK;
            return ResponseEntity.status(status).body(response);
        }
        HttpStatus status = Boolean.TRUE.equals(response.getSuccess())
                ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(response);
    }

    private static boolean matches(String configured, String provided) {
        if (provided == null) {
            return false;
        }
        return MessageDigest.isEqual(configured.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }

    private static ResponseEntity<Object> error(HttpStatus status, String message, String code) {
        return ResponseEntity.status(status).body(ErrorResponse.builder().error(message).code(code).build());
    }
}
