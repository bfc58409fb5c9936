package com.travelease.formapi.interfaces.rest;

import com.travelease.formapi.infrastructure.metrics.MetricsPublisher;
import com.travelease.formapi.interfaces.rest.dto.ErrorResponse;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

/**
 * Errors raised outside the submission pipeline. Every response body is JSON.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private final MetricsPublisher metricsPublisher;

    public GlobalExceptionHandler(MetricsPublisher metricsPublisher) {
        this.metricsPublisher = metricsPublisher;
    }

    @ExceptionHandler(RequestNotPermitted.class)
    public Mono<ResponseEntity<ErrorResponse>> handleRateLimit(RequestNotPermitted e) {
        metricsPublisher.incrementRateLimit();
        logger.warn("Rate limit exceeded: {}", e.getMessage());
        return Mono.just(json(HttpStatus.TOO_MANY_REQUESTS, "Too many requests"));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(ServerWebInputException e) {
        logger.warn("Unreadable request: {}", e.getReason());
        return Mono.just(json(HttpStatus.BAD_REQUEST, e.getReason() != null ? e.getReason() : "Invalid request"));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleUnexpected(Exception e) {
        logger.error("Unexpected error: {}", e.getMessage(), e);
        return Mono.just(json(HttpStatus.INTERNAL_SERVER_ERROR, ResponseAggregator.describe(e)));
    }

    private static ResponseEntity<ErrorResponse> json(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse(message));
    }
}
