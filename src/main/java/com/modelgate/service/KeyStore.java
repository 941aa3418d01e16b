package com.modelgate.service;

import com.modelgate.model.dto.KeyLookup;
import com.modelgate.model.entity.ApiKey;
import com.modelgate.repository.ApiKeyRepository;
import com.modelgate.util.ApiKeyUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Resolves a raw API key to its owning principal. Read-only.
 */
@Service
@RequiredArgsConstructor
public class KeyStore {

    private final ApiKeyRepository apiKeyRepository;
    private final Clock clock;

    /**
     * Look up a raw credential by its hash among enabled keys.
     *
     * @param rawCredential API key as presented by the caller
     * @return lookup result; never empty
     */
    public Mono<KeyLookup> lookup(String rawCredential) {
        String keyHash = ApiKeyUtil.hashApiKey(rawCredential);
        return apiKeyRepository.findByKeyHashAndEnabledTrue(keyHash)
                .map(this::toLookup)
                .defaultIfEmpty(KeyLookup.notFound());
    }

    private KeyLookup toLookup(ApiKey key) {
        LocalDateTime expiresAt = key.getExpiresAt();
        boolean expired = expiresAt != null && expiresAt.isBefore(LocalDateTime.now(clock));
        return KeyLookup.builder()
                .found(true)
                .principalId(key.getPrincipalId())
                .keyId(key.getId())
                .expired(expired)
                .build();
    }
}
