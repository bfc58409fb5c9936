package com.travelease.formapi.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "aws")
@Validated
public record AwsConfig(
        String region,
        String endpointUrl,
        String accessKeyId,
        String secretAccessKey,
        Sqs sqs,
        Dynamodb dynamodb,
        Ses ses,
        Sns sns
) {
    public AwsConfig {
        if (region == null || region.isBlank()) {
            region = "us-east-1";
        }
        if (sqs == null) {
            sqs = new Sqs(null);
        }
        if (dynamodb == null) {
            dynamodb = new Dynamodb(null);
        }
        if (ses == null) {
            ses = new Ses(null, null, null, null);
        }
        if (sns == null) {
            sns = new Sns(null);
        }
    }

    public record Sqs(
            String queueUrl
    ) {}

    public record Dynamodb(
            String tableName
    ) {}

    public record Ses(
            String sourceEmail,
            String ownerEmail,
            String businessEmail,
            String configurationSet
    ) {}

    public record Sns(
            String topicArn
    ) {}
}
