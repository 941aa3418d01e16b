package com.modelgate.controller;

import com.modelgate.model.dto.RateLimitStatusResponse;
import com.modelgate.service.QuotaLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Quota status of the calling principal. Reading it does not consume a request.
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class RateLimitController {

    private final QuotaLedger quotaLedger;

    @GetMapping("/rate-limit")
    public Mono<RateLimitStatusResponse> rateLimit(@AuthenticationPrincipal String principalId) {
        return quotaLedger.status(principalId)
                .map(quota -> RateLimitStatusResponse.builder()
                        .remaining(quota.getRemaining())
                        .limit(quota.getLimit())
                        .requestCount(quota.getRequestCount())
                        .timeWindow(quota.getWindowMs())
                        .lastRequest(quota.getLastRequest())
                        .build());
    }
}
