package com.modelgate.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result of validating a request credential, optionally charged against the quota.
 * Quota fields are null when the ledger was not consulted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationResult {

    private boolean valid;
    private ValidationErrorCode errorCode;
    private String error;
    private String principalId;
    private String keyId;
    private Integer remaining;
    private Integer limit;
    private Instant lastRequest;
    private Long windowMs;
    private Integer requestCount;

    public static ValidationResult failure(ValidationErrorCode code, String error) {
        return ValidationResult.builder()
                .valid(false)
                .errorCode(code)
                .error(error)
                .build();
    }

    /**
     * Merge a ledger outcome with the resolved key.
     */
    public static ValidationResult fromQuota(KeyLookup key, QuotaOutcome quota) {
        ValidationResultBuilder builder = ValidationResult.builder()
                .valid(quota.isAccepted())
                .principalId(key.getPrincipalId())
                .keyId(key.getKeyId())
                .remaining(quota.getRemaining())
                .limit(quota.getLimit())
                .lastRequest(quota.getLastRequest())
                .windowMs(quota.getWindowMs())
                .requestCount(quota.getRequestCount());
        if (!quota.isAccepted()) {
            builder.errorCode(ValidationErrorCode.RATE_LIMITED).error("Rate limit exceeded");
        }
        return builder.build();
    }

    /**
     * Epoch second at which the current window closes, or null without quota data.
     */
    public Long resetEpochSeconds() {
        if (lastRequest == null || windowMs == null) {
            return null;
        }
        return Math.floorDiv(lastRequest.toEpochMilli() + windowMs, 1000L);
    }

    public long retryAfterSeconds(Instant now) {
        if (lastRequest == null || windowMs == null) {
            return 0;
        }
        long waitMillis = lastRequest.toEpochMilli() + windowMs - now.toEpochMilli();
        return waitMillis <= 0 ? 0 : (waitMillis + 999) / 1000;
    }
}
