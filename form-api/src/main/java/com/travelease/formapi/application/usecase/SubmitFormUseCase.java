package com.travelease.formapi.application.usecase;

import com.travelease.formapi.domain.exception.SubmissionValidationException;
import com.travelease.formapi.domain.model.DispatchReport;
import com.travelease.formapi.domain.model.RequestEnvelope;
import com.travelease.formapi.domain.service.RequestDecoder;
import com.travelease.formapi.domain.service.SubmissionDispatcher;
import com.travelease.formapi.domain.service.SubmissionFactory;
import com.travelease.formapi.infrastructure.metrics.MetricsPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Decode, validate and dispatch one form submission.
 */
@Service
public class SubmitFormUseCase {

    private static final Logger logger = LoggerFactory.getLogger(SubmitFormUseCase.class);
    private final RequestDecoder requestDecoder;
    private final SubmissionFactory submissionFactory;
    private final SubmissionDispatcher submissionDispatcher;
    private final MetricsPublisher metricsPublisher;

    public SubmitFormUseCase(RequestDecoder requestDecoder, SubmissionFactory submissionFactory,
                             SubmissionDispatcher submissionDispatcher, MetricsPublisher metricsPublisher) {
        this.requestDecoder = requestDecoder;
        this.submissionFactory = submissionFactory;
        this.submissionDispatcher = submissionDispatcher;
        this.metricsPublisher = metricsPublisher;
    }

    public Mono<DispatchReport> execute(RequestEnvelope envelope, String correlationId) {
        return Mono.fromCallable(() -> submissionFactory.build(requestDecoder.decode(envelope)))
                .doOnNext(submission -> logger.info("Submission accepted, submissionId: {}, correlationId: {}, inquiryType: {}",
                        submission.submissionId(), correlationId, submission.inquiryType()))
                .flatMap(submissionDispatcher::dispatch)
                .doOnSuccess(report -> {
                    metricsPublisher.incrementSubmission("success");
                    logger.info("Submission processed, submissionId: {}, correlationId: {}",
                            report.submission().submissionId(), correlationId);
                })
                .doOnError(SubmissionValidationException.class, e -> {
                    metricsPublisher.incrementSubmission("validation_error");
                    logger.warn("Submission rejected, correlationId: {}, error: {}", correlationId, e.getMessage());
                })
                .doOnError(e -> !(e instanceof SubmissionValidationException), e -> {
                    metricsPublisher.incrementSubmission("error");
                    logger.error("Submission failed, correlationId: {}, error: {}", correlationId, e.getMessage());
                });
    }
}
