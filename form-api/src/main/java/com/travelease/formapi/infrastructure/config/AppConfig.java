package com.travelease.formapi.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.travelease.formapi.domain.model.DispatchSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({AwsConfig.class, SubmissionProperties.class})
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    private final AwsConfig awsConfig;
    private final SubmissionProperties submissionProperties;

    public AppConfig(AwsConfig awsConfig, SubmissionProperties submissionProperties) {
        this.awsConfig = awsConfig;
        this.submissionProperties = submissionProperties;
    }

    @Bean
    public DispatchSettings dispatchSettings() {
        DispatchSettings settings = new DispatchSettings(
                awsConfig.ses().sourceEmail(),
                awsConfig.ses().ownerEmail(),
                awsConfig.ses().businessEmail(),
                awsConfig.ses().configurationSet(),
                awsConfig.sqs().queueUrl(),
                awsConfig.dynamodb().tableName(),
                awsConfig.sns().topicArn(),
                submissionProperties.dispatch().executionMode(),
                submissionProperties.dispatch().failureMode());

        if (settings.sourceEmail() == null) {
            logger.warn("aws.ses.source-email is not set, every submission will fail until it is configured");
        }
        logger.info("Dispatch configured, queue: {}, table: {}, topic: {}, business email: {}, mode: {}/{}",
                settings.queueUrl() != null, settings.tableName() != null, settings.topicArn() != null,
                settings.distinctBusinessEmail() != null, settings.executionMode(), settings.failureMode());
        return settings;
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
