package com.modelgate.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Fixed-key bookkeeping rows: the sync lease and the last successful sync.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("sync_meta")
public class SyncMeta {

    public static final String SYNC_LOCK_KEY = "sync_in_progress";
    public static final String CATALOG_LAST_UPDATED_KEY = "catalog_last_updated";

    @Id
    @Column("meta_key")
    private String key;

    @Column("meta_value")
    private String value;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
