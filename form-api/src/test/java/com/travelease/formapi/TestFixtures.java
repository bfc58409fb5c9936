package com.travelease.formapi;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.travelease.formapi.domain.model.DispatchSettings;
import com.travelease.formapi.domain.model.DispatchSettings.ExecutionMode;
import com.travelease.formapi.domain.model.DispatchSettings.FailureMode;
import com.travelease.formapi.domain.model.Submission;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public final class TestFixtures {

    public static final String SOURCE_EMAIL = "sender@travelease.test";
    public static final String OWNER_EMAIL = "owner@travelease.test";
    public static final String BUSINESS_EMAIL = "sales@travelease.test";
    public static final String QUEUE_URL = "https://sqs.us-east-1.amazonaws.com/000000000000/travelease-form";
    public static final String TABLE_NAME = "travelease-form";
    public static final String TOPIC_ARN = "arn:aws:sns:us-east-1:000000000000:FormSubmissionTopic";
    public static final String CONFIGURATION_SET = "TravelEaseBounceConfig";

    public static final UUID SUBMISSION_ID = UUID.fromString("3f2c6b1e-8a4d-4c1b-9e7a-2d5f0c8b9a11");
    public static final Instant CREATED_AT = Instant.parse("2025-03-14T09:26:53Z");

    private TestFixtures() {
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public static Map<String, Object> validPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", "A");
        payload.put("email", "a@x.com");
        payload.put("phone", "123");
        payload.put("inquiry_type", "Tour");
        payload.put("message", "Hi");
        return payload;
    }

    public static Submission submission() {
        return new Submission(SUBMISSION_ID, "Ada Lovelace", "ada@example.com", "+44 20 7946 0000",
                "Tour", "Looking for a week in Lisbon.", CREATED_AT);
    }

    public static DispatchSettings allChannels() {
        return new DispatchSettings(SOURCE_EMAIL, OWNER_EMAIL, BUSINESS_EMAIL, CONFIGURATION_SET,
                QUEUE_URL, TABLE_NAME, TOPIC_ARN, ExecutionMode.SEQUENTIAL, FailureMode.FAIL_FAST);
    }

    public static DispatchSettings allChannelsBusinessIsOwner() {
        return new DispatchSettings(SOURCE_EMAIL, OWNER_EMAIL, OWNER_EMAIL, CONFIGURATION_SET,
                QUEUE_URL, TABLE_NAME, TOPIC_ARN, ExecutionMode.SEQUENTIAL, FailureMode.FAIL_FAST);
    }
}
