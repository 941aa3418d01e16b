package com.modelgate.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters of one catalog sync cycle. A non-null {@code error} means the cycle failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncResult {

    private int totalFetched;
    private int qualifying;
    private int inserted;
    private int updated;
    private int deactivated;
    private String error;

    public static SyncResult failed(String error) {
        return SyncResult.builder().error(error).build();
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return error == null;
    }
}
