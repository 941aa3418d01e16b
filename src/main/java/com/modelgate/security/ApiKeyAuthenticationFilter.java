package com.modelgate.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelgate.model.dto.ErrorResponse;
import com.modelgate.model.dto.ValidationErrorCode;
import com.modelgate.model.dto.ValidationResult;
import com.modelgate.service.ApiKeyValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Collections;

/**
 * Filter for API Key authentication.
 * Validates Bearer tokens, charges catalog reads against the principal's quota and sets the
 * principal ID in the security context.
 */
@Slf4j
@RequiredArgsConstructor
public class ApiKeyAuthenticationFilter implements WebFilter {

    static final String CHARGED_PATH_PREFIX = "/api/v1/";
    static final String UNCHARGED_PATH_PREFIX = "/api/auth/";

    private final ApiKeyValidator apiKeyValidator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        String authHeader = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);

        Mono<ValidationResult> validation;
        if (HttpMethod.OPTIONS.equals(exchange.getRequest().getMethod())) {
            // CORS preflight carries no credentials
            return chain.filter(exchange);
        } else if (path.startsWith(CHARGED_PATH_PREFIX)) {
            validation = apiKeyValidator.validate(authHeader);
        } else if (path.startsWith(UNCHARGED_PATH_PREFIX)) {
            validation = apiKeyValidator.validateWithoutQuota(authHeader);
        } else {
            return chain.filter(exchange);
        }

        return validation.flatMap(result -> {
            RateLimitHeaders.apply(exchange.getResponse().getHeaders(), result, clock.instant());
            if (!result.isValid()) {
                return reject(exchange, result);
            }

            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(result.getPrincipalId(), null, Collections.emptyList());
            return chain.filter(exchange)
                    .contextWrite(ReactiveSecurityContextHolder.withAuthentication(authentication));
        });
    }

    static HttpStatus statusFor(ValidationErrorCode code) {
        if (code.isServerSide()) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (code == ValidationErrorCode.RATE_LIMITED) {
            return HttpStatus.TOO_MANY_REQUESTS;
        }
        return HttpStatus.UNAUTHORIZED;
    }

    private Mono<Void> reject(ServerWebExchange exchange, ValidationResult result) {
        ValidationErrorCode code = result.getErrorCode() != null ? result.getErrorCode()
                : ValidationErrorCode.SERVER_ERROR;
        log.warn("Rejected {} {}: {}", exchange.getRequest().getMethod(),
                exchange.getRequest().getPath().value(), code);

        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(statusFor(code));
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);

        ErrorResponse body = ErrorResponse.builder()
                .error(result.getError())
                .code(code.name())
                .build();
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize error response", e);
            bytes = ("{\"error\":\"Internal server error\",\"code\":\"" + code.name() + "\"}")
                    .getBytes(StandardCharsets.UTF_8);
        }
        DataBuffer buffer = response.bufferFactory().wrap(bytes);
        return response.writeWith(Mono.just(buffer));
    }
}
