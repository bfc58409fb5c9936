package com.travelease.formapi.interfaces.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SubmissionResponse(
        @JsonProperty("message") String message,
        @JsonProperty("submission_id") String submissionId,
        @JsonProperty("customer_ses_message_id") String customerSesMessageId,
        @JsonProperty("owner_ses_message_id") String ownerSesMessageId,
        @JsonProperty("business_ses_message_id") String businessSesMessageId,
        @JsonProperty("sqs_message_id") String sqsMessageId,
        @JsonProperty("sns_message_id") String snsMessageId,
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        @JsonProperty("failed_channels") List<String> failedChannels
) {}
