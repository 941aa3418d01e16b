package com.modelgate.security;

import com.modelgate.model.dto.ValidationResult;
import org.springframework.http.HttpHeaders;

import java.time.Instant;

/**
 * Writes quota metadata of a validation result as response headers.
 */
public final class RateLimitHeaders {

    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";

    private RateLimitHeaders() {
    }

    /**
     * Add the limit, remaining and reset headers, plus {@code Retry-After} when the request was
     * rejected for quota. Results without quota data leave the headers untouched.
     */
    public static void apply(HttpHeaders headers, ValidationResult result, Instant now) {
        if (result.getLimit() != null) {
            headers.set(LIMIT, String.valueOf(result.getLimit()));
        }
        if (result.getRemaining() != null) {
            headers.set(REMAINING, String.valueOf(result.getRemaining()));
        }
        Long reset = result.resetEpochSeconds();
        if (reset != null) {
            headers.set(RESET, String.valueOf(reset));
        }
        if (!result.isValid() && result.getLastRequest() != null) {
            headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(result.retryAfterSeconds(now)));
        }
    }
}
