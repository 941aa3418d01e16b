package com.modelgate.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Current quota of the calling principal, read without charging it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitStatusResponse {
    private int remaining;
    private int limit;
    private int requestCount;
    private long timeWindow;
    private Instant lastRequest;
}
