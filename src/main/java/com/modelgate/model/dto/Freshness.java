package com.modelgate.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Age of the catalog mirror relative to the staleness thresholds.
 * {@code ageMs} is {@link Long#MAX_VALUE} when the catalog was never synced.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Freshness {

    private LocalDateTime lastUpdated;
    private long ageMs;
    private boolean fresh;
    private boolean criticallyStale;

    @JsonIgnore
    public boolean isNeverSynced() {
        return lastUpdated == null;
    }
}
