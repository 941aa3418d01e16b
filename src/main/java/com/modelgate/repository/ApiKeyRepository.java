package com.modelgate.repository;

import com.modelgate.model.entity.ApiKey;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Repository for API Key entities.
 */
@Repository
public interface ApiKeyRepository extends ReactiveCrudRepository<ApiKey, String> {

    /**
     * Find an enabled API key by key hash. Disabled keys are never returned.
     */
    Mono<ApiKey> findByKeyHashAndEnabledTrue(String keyHash);
}
