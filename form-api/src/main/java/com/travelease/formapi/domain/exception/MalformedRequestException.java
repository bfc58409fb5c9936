package com.travelease.formapi.domain.exception;

public class MalformedRequestException extends SubmissionValidationException {

    public MalformedRequestException(String message) {
        super(message);
    }

    public MalformedRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
