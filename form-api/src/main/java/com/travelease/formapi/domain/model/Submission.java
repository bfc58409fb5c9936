package com.travelease.formapi.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.UUID;

public record Submission(
        @JsonProperty("submission_id") UUID submissionId,
        @JsonProperty("name") String name,
        @JsonProperty("email") String email,
        @JsonProperty("phone") String phone,
        @JsonProperty("inquiry_type") String inquiryType,
        @JsonProperty("message") String message,
        @JsonProperty("created_at") Instant createdAt
) {
    public Submission {
        if (submissionId == null) {
            throw new IllegalArgumentException("Submission ID is required");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Creation timestamp is required");
        }
    }

    public static Submission of(UUID submissionId, SubmissionRequest request, Instant createdAt) {
        return new Submission(
                submissionId,
                request.name(),
                request.email(),
                request.phone(),
                request.inquiryType(),
                request.message(),
                createdAt);
    }
}
