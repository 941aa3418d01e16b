package com.modelgate.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Response of a sync trigger: either a skip with its reason, or the outcome of a run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncTriggerResponse {

    private Boolean skipped;
    private SkipReason reason;
    private Boolean success;
    private SyncResult result;
    private Long durationMs;
    private LocalDateTime lastUpdated;

    public static SyncTriggerResponse skipped(SkipReason reason, LocalDateTime lastUpdated) {
        return SyncTriggerResponse.builder()
                .skipped(true)
                .reason(reason)
                .lastUpdated(lastUpdated)
                .build();
    }

    public boolean wasSkipped() {
        return Boolean.TRUE.equals(skipped);
    }
}
