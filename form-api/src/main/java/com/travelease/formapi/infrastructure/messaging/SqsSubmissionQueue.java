package com.travelease.formapi.infrastructure.messaging;

import com.travelease.formapi.domain.port.SubmissionQueue;
import com.travelease.formapi.infrastructure.exception.InfrastructureException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

@Component
public class SqsSubmissionQueue implements SubmissionQueue {

    private static final Logger logger = LoggerFactory.getLogger(SqsSubmissionQueue.class);
    private final SqsAsyncClient sqsAsyncClient;
    private final CircuitBreaker queueCircuitBreaker;

    public SqsSubmissionQueue(SqsAsyncClient sqsAsyncClient,
                              @Qualifier("queueCircuitBreaker") CircuitBreaker queueCircuitBreaker) {
        this.sqsAsyncClient = sqsAsyncClient;
        this.queueCircuitBreaker = queueCircuitBreaker;
    }

    @Override
    public Mono<String> enqueue(String queueUrl, String messageBody) {
        return Mono.defer(() -> Mono.fromFuture(sqsAsyncClient.sendMessage(SendMessageRequest.builder()
                        .queueUrl(queueUrl)
                        .messageBody(messageBody)
                        .build())))
                .map(SendMessageResponse::messageId)
                .doOnSuccess(messageId -> logger.debug("Message sent to SQS, messageId: {}", messageId))
                .doOnError(e -> logger.error("Failed to send message to SQS, error: {}", e.getMessage()))
                .onErrorMap(e -> InfrastructureException.wrap("SQS", e))
                .transformDeferred(CircuitBreakerOperator.of(queueCircuitBreaker));
    }
}
