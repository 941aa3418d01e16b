package com.modelgate.repository;

import com.modelgate.model.entity.SyncMeta;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

/**
 * Read access to the sync bookkeeping rows. Writes go through {@code SyncLock} and {@code CatalogSyncer}.
 */
@Repository
public interface SyncMetaRepository extends ReactiveCrudRepository<SyncMeta, String> {
}
