package com.travelease.formapi.infrastructure.messaging;

import com.travelease.formapi.domain.port.SubmissionBroadcaster;
import com.travelease.formapi.infrastructure.exception.InfrastructureException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.sns.SnsAsyncClient;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;

@Component
public class SnsSubmissionBroadcaster implements SubmissionBroadcaster {

    // SNS rejects subjects longer than 100 characters or containing line breaks.
    static final int MAX_SUBJECT_LENGTH = 100;

    private static final Logger logger = LoggerFactory.getLogger(SnsSubmissionBroadcaster.class);
    private final SnsAsyncClient snsAsyncClient;
    private final CircuitBreaker broadcastCircuitBreaker;

    public SnsSubmissionBroadcaster(SnsAsyncClient snsAsyncClient,
                                    @Qualifier("broadcastCircuitBreaker") CircuitBreaker broadcastCircuitBreaker) {
        this.snsAsyncClient = snsAsyncClient;
        this.broadcastCircuitBreaker = broadcastCircuitBreaker;
    }

    @Override
    public Mono<String> publish(String topicArn, String subject, String message) {
        return Mono.defer(() -> Mono.fromFuture(snsAsyncClient.publish(PublishRequest.builder()
                        .topicArn(topicArn)
                        .subject(sanitizeSubject(subject))
                        .message(message)
                        .build())))
                .map(PublishResponse::messageId)
                .doOnSuccess(messageId -> logger.debug("Message published to SNS, messageId: {}", messageId))
                .doOnError(e -> logger.error("Failed to publish to SNS, topic: {}, error: {}", topicArn, e.getMessage()))
                .onErrorMap(e -> InfrastructureException.wrap("SNS", e))
                .transformDeferred(CircuitBreakerOperator.of(broadcastCircuitBreaker));
    }

    static String sanitizeSubject(String subject) {
        String singleLine = subject.replaceAll("[\\r\\n]+", " ").trim();
        return singleLine.length() > MAX_SUBJECT_LENGTH ? singleLine.substring(0, MAX_SUBJECT_LENGTH) : singleLine;
    }
}
