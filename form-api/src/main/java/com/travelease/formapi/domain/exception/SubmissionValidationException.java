package com.travelease.formapi.domain.exception;

/**
 * Raised for client-side problems with a submission. Mapped to HTTP 400.
 */
public class SubmissionValidationException extends RuntimeException {

    public SubmissionValidationException(String message) {
        super(message);
    }

    public SubmissionValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
