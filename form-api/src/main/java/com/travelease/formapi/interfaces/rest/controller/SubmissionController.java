package com.travelease.formapi.interfaces.rest.controller;

import com.travelease.formapi.application.usecase.SubmitFormUseCase;
import com.travelease.formapi.domain.model.RequestEnvelope;
import com.travelease.formapi.interfaces.rest.ResponseAggregator;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.UUID;

@RestController
public class SubmissionController {

    static final String TRANSFER_ENCODING_HEADER = "Content-Transfer-Encoding";

    private static final Logger logger = LoggerFactory.getLogger(SubmissionController.class);
    private final SubmitFormUseCase submitFormUseCase;
    private final ResponseAggregator responseAggregator;
    private final RateLimiter rateLimiter;

    public SubmissionController(SubmitFormUseCase submitFormUseCase, ResponseAggregator responseAggregator,
                                @Qualifier("submissionRateLimiter") RateLimiter rateLimiter) {
        this.submitFormUseCase = submitFormUseCase;
        this.responseAggregator = responseAggregator;
        this.rateLimiter = rateLimiter;
    }

    @PostMapping(value = "/submit", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> submit(
            @RequestBody(required = false) Mono<byte[]> body,
            @RequestHeader(value = TRANSFER_ENCODING_HEADER, defaultValue = "") String transferEncoding,
            @RequestHeader(value = "X-Correlation-Id", defaultValue = "") String correlationId) {
        String effectiveCorrelationId = correlationId.isEmpty() ? UUID.randomUUID().toString() : correlationId;
        boolean base64 = "base64".equalsIgnoreCase(transferEncoding.trim());
        logger.debug("Received submission, correlationId: {}, base64: {}", effectiveCorrelationId, base64);

        return body
                .defaultIfEmpty(new byte[0])
                .map(bytes -> new RequestEnvelope(bytes, base64))
                .transformDeferred(RateLimiterOperator.of(rateLimiter))
                .flatMap(envelope -> submitFormUseCase.execute(envelope, effectiveCorrelationId)
                        .map(responseAggregator::success)
                        .onErrorResume(e -> Mono.just(responseAggregator.failure(e))));
    }
}
