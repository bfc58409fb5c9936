package com.travelease.formapi.domain.exception;

import java.util.List;

public class MissingFieldsException extends SubmissionValidationException {

    private final List<String> fields;

    public MissingFieldsException(List<String> fields) {
        super("Missing required fields: " + String.join(", ", fields));
        this.fields = List.copyOf(fields);
    }

    public List<String> getFields() {
        return fields;
    }
}
