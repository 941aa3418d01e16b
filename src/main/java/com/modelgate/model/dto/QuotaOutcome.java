package com.modelgate.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Quota state of one principal after a charge attempt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaOutcome {

    private boolean accepted;
    private int remaining;
    private int limit;
    private Instant lastRequest;
    private long windowMs;
    private int requestCount;
}
