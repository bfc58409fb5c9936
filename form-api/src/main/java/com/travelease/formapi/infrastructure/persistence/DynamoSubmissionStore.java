package com.travelease.formapi.infrastructure.persistence;

import com.travelease.formapi.domain.model.Submission;
import com.travelease.formapi.domain.port.SubmissionStore;
import com.travelease.formapi.infrastructure.exception.InfrastructureException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbAsyncTable;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedAsyncClient;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class DynamoSubmissionStore implements SubmissionStore {

    private static final Logger logger = LoggerFactory.getLogger(DynamoSubmissionStore.class);
    private static final TableSchema<SubmissionItem> SCHEMA = TableSchema.fromBean(SubmissionItem.class);

    private final DynamoDbEnhancedAsyncClient enhancedClient;
    private final CircuitBreaker storeCircuitBreaker;
    private final Map<String, DynamoDbAsyncTable<SubmissionItem>> tables = new ConcurrentHashMap<>();

    public DynamoSubmissionStore(DynamoDbEnhancedAsyncClient enhancedClient,
                                 @Qualifier("storeCircuitBreaker") CircuitBreaker storeCircuitBreaker) {
        this.enhancedClient = enhancedClient;
        this.storeCircuitBreaker = storeCircuitBreaker;
    }

    @Override
    public Mono<Void> put(String tableName, Submission submission) {
        return Mono.fromCallable(() -> SubmissionItem.from(submission))
                .flatMap(item -> Mono.fromFuture(table(tableName).putItem(item)))
                .doOnSuccess(v -> logger.info("Submission saved to DynamoDB, submissionId: {}", submission.submissionId()))
                .doOnError(e -> logger.error("Failed to save submission to DynamoDB, submissionId: {}, error: {}",
                        submission.submissionId(), e.getMessage()))
                .onErrorMap(e -> InfrastructureException.wrap("DynamoDB", e))
                .transformDeferred(CircuitBreakerOperator.of(storeCircuitBreaker))
                .then();
    }

    private DynamoDbAsyncTable<SubmissionItem> table(String tableName) {
        return tables.computeIfAbsent(tableName, name -> enhancedClient.table(name, SCHEMA));
    }
}
