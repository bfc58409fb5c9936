package com.travelease.formapi.interfaces.rest;

import com.travelease.formapi.domain.exception.SubmissionValidationException;
import com.travelease.formapi.domain.model.Channel;
import com.travelease.formapi.domain.model.DispatchReport;
import com.travelease.formapi.interfaces.rest.dto.ErrorResponse;
import com.travelease.formapi.interfaces.rest.dto.SubmissionResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Maps a dispatch report, or the error that ended the pipeline, onto the HTTP response.
 * Failure responses never carry partial dispatch results.
 */
@Component
public class ResponseAggregator {

    static final String SUCCESS_MESSAGE = "Form submitted successfully";

    public ResponseEntity<Object> success(DispatchReport report) {
        SubmissionResponse body = new SubmissionResponse(
                SUCCESS_MESSAGE,
                report.submission().submissionId().toString(),
                report.referenceOf(Channel.CUSTOMER_EMAIL),
                report.referenceOf(Channel.OWNER_EMAIL),
                report.referenceOf(Channel.BUSINESS_EMAIL),
                report.referenceOf(Channel.QUEUE),
                report.referenceOf(Channel.BROADCAST),
                report.failedChannels().stream().map(Channel::tag).toList());
        return json(HttpStatus.OK, body);
    }

    public ResponseEntity<Object> failure(Throwable error) {
        if (error instanceof SubmissionValidationException) {
            return json(HttpStatus.BAD_REQUEST, new ErrorResponse(error.getMessage()));
        }
        return json(HttpStatus.INTERNAL_SERVER_ERROR, new ErrorResponse(describe(error)));
    }

    static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    private static ResponseEntity<Object> json(HttpStatus status, Object body) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }
}
