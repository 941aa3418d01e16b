package com.modelgate.exception;

import com.modelgate.config.RequestIdFilter;
import com.modelgate.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResourceNotFound(ResourceNotFoundException ex,
                                                                      ServerWebExchange exchange) {
        log.warn("Resource not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), "NOT_FOUND", exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(WebExchangeBindException ex,
                                                                        ServerWebExchange exchange) {
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, "Validation failed: " + errors, "BAD_REQUEST", exchange);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(ServerWebInputException ex,
                                                                   ServerWebExchange exchange) {
        log.warn("Bad request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, ex.getReason(), "BAD_REQUEST", exchange);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", "INTERNAL_ERROR", exchange);
    }

    private Mono<ResponseEntity<ErrorResponse>> respond(HttpStatus status, String detail, String code,
                                                        ServerWebExchange exchange) {
        ErrorResponse error = ErrorResponse.builder()
                .error(detail)
                .code(code)
                .traceId(RequestIdFilter.requestId(exchange))
                .build();
        return Mono.just(ResponseEntity.status(status).body(error));
    }
}
