package com.travelease.formapi.domain.model;

/**
 * Form fields after the required-field check. Every component is a non-blank string.
 */
public record SubmissionRequest(
        String name,
        String email,
        String phone,
        String inquiryType,
        String message
) {}
