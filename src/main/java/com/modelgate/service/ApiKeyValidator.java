package com.modelgate.service;

import com.modelgate.config.GatewayProperties;
import com.modelgate.model.dto.KeyLookup;
import com.modelgate.model.dto.ValidationErrorCode;
import com.modelgate.model.dto.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Single entry point for credential checks on protected request paths.
 *
 * <p>Failures are returned as {@link ValidationResult} values rather than errors so callers can
 * build protocol-specific responses. Unauthenticated attempts never reach the quota ledger.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyValidator {

    private static final String BEARER_PREFIX = "Bearer ";

    private final KeyStore keyStore;
    private final QuotaLedger quotaLedger;
    private final GatewayProperties properties;

    /**
     * Validate the Authorization header and charge the owning principal one request.
     *
     * @param authorizationHeader raw header value, may be null
     * @return validation result with quota metadata when the key resolved
     */
    public Mono<ValidationResult> validate(String authorizationHeader) {
        return withCredential(authorizationHeader, this::validateKey);
    }

    /**
     * Validate a raw API key and charge the owning principal one request.
     */
    public Mono<ValidationResult> validateKey(String rawCredential) {
        if (!properties.getRateLimit().isUsable()) {
            log.error("Rate limit defaults are not usable: {}", properties.getRateLimit());
            return Mono.just(ValidationResult.failure(ValidationErrorCode.CONFIG_ERROR,
                    "Server configuration error: rate limit defaults"));
        }

        return keyStore.lookup(rawCredential)
                .flatMap(key -> {
                    ValidationResult keyFailure = keyFailure(key);
                    if (keyFailure != null) {
                        return Mono.just(keyFailure);
                    }
                    return quotaLedger.consume(key.getPrincipalId())
                            .map(quota -> ValidationResult.fromQuota(key, quota));
                })
                .onErrorResume(this::serverError);
    }

    /**
     * Validate the Authorization header without charging the quota.
     * Used where the caller must hold a valid key but should not pay for the request.
     */
    public Mono<ValidationResult> validateWithoutQuota(String authorizationHeader) {
        return withCredential(authorizationHeader, rawCredential -> keyStore.lookup(rawCredential)
                .map(key -> {
                    ValidationResult keyFailure = keyFailure(key);
                    if (keyFailure != null) {
                        return keyFailure;
                    }
                    return ValidationResult.builder()
                            .valid(true)
                            .principalId(key.getPrincipalId())
                            .keyId(key.getKeyId())
                            .build();
                })
                .onErrorResume(this::serverError));
    }

    private Mono<ValidationResult> withCredential(String authorizationHeader,
                                                  Function<String, Mono<ValidationResult>> next) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Mono.just(ValidationResult.failure(ValidationErrorCode.MISSING_AUTH,
                    "Missing Authorization header"));
        }
        if (!authorizationHeader.startsWith(BEARER_PREFIX)) {
            return Mono.just(ValidationResult.failure(ValidationErrorCode.INVALID_FORMAT,
                    "Invalid Authorization format. Use: Bearer <api-key>"));
        }

        String rawCredential = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        if (rawCredential.isEmpty()) {
            return Mono.just(ValidationResult.failure(ValidationErrorCode.EMPTY_KEY, "API key is empty"));
        }
        return next.apply(rawCredential);
    }

    private ValidationResult keyFailure(KeyLookup key) {
        if (!key.isFound()) {
            return ValidationResult.failure(ValidationErrorCode.INVALID_KEY, "Invalid API key");
        }
        if (key.isExpired()) {
            return ValidationResult.failure(ValidationErrorCode.EXPIRED_KEY, "API key expired");
        }
        return null;
    }

    private Mono<ValidationResult> serverError(Throwable error) {
        log.error("API key validation failed", error);
        return Mono.just(ValidationResult.failure(ValidationErrorCode.SERVER_ERROR, "Internal server error"));
    }
}
