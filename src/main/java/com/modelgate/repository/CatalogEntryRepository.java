package com.modelgate.repository;

import com.modelgate.model.entity.CatalogEntry;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Repository for mirrored catalog entries.
 */
@Repository
public interface CatalogEntryRepository extends ReactiveCrudRepository<CatalogEntry, String> {

    /**
     * Active entries in id order.
     */
    @Query("SELECT * FROM catalog_entries WHERE is_active = TRUE ORDER BY id")
    Flux<CatalogEntry> findActive();

    Mono<Long> countByActiveTrue();
}
