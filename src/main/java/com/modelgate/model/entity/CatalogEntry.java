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
 * Mirrored upstream model. Entries are deactivated, never deleted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("catalog_entries")
public class CatalogEntry {

    @Id
    private String id;

    @Column("name")
    private String name;

    @Column("description")
    private String description;

    @Column("context_length")
    private Integer contextLength;

    @Column("max_completion_tokens")
    private Integer maxCompletionTokens;

    @Column("modality")
    private String modality;

    @Column("input_modalities")
    private String inputModalities; // JSON array

    @Column("output_modalities")
    private String outputModalities; // JSON array

    @Column("supported_parameters")
    private String supportedParameters; // JSON array

    @Column("is_moderated")
    private Boolean moderated;

    @Column("is_active")
    private Boolean active;

    @Column("last_seen_at")
    private LocalDateTime lastSeenAt;

    @Column("created_at")
    private LocalDateTime createdAt;
}
