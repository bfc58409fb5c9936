package com.travelease.formapi.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedAsyncClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.ses.SesAsyncClient;
import software.amazon.awssdk.services.sns.SnsAsyncClient;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import java.net.URI;

/**
 * Async AWS clients, created once per process. All clients share the region, the optional
 * endpoint override and the optional static credentials.
 */
@Configuration
public class AwsClientConfig {

    private final AwsConfig awsConfig;

    public AwsClientConfig(AwsConfig awsConfig) {
        this.awsConfig = awsConfig;
    }

    @Bean
    public SqsAsyncClient sqsAsyncClient() {
        return configure(SqsAsyncClient.builder()).build();
    }

    @Bean
    public DynamoDbAsyncClient dynamoDbClient() {
        return configure(DynamoDbAsyncClient.builder()).build();
    }

    @Bean
    public DynamoDbEnhancedAsyncClient dynamoDbEnhancedClient(DynamoDbAsyncClient dynamoDbClient) {
        return DynamoDbEnhancedAsyncClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }

    @Bean
    public SesAsyncClient sesAsyncClient() {
        return configure(SesAsyncClient.builder()).build();
    }

    @Bean
    public SnsAsyncClient snsAsyncClient() {
        return configure(SnsAsyncClient.builder()).build();
    }

    private <B extends AwsClientBuilder<B, C>, C> B configure(B builder) {
        builder.region(Region.of(awsConfig.region()));

        if (awsConfig.endpointUrl() != null && !awsConfig.endpointUrl().isBlank()) {
            builder.endpointOverride(URI.create(awsConfig.endpointUrl()));
        }

        if (awsConfig.accessKeyId() != null && awsConfig.secretAccessKey() != null) {
            builder.credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(awsConfig.accessKeyId(), awsConfig.secretAccessKey())));
        } else {
            builder.credentialsProvider(DefaultCredentialsProvider.create());
        }

        return builder;
    }
}
