package com.travelease.formapi.interfaces.rest;

import com.travelease.formapi.TestFixtures;
import com.travelease.formapi.domain.exception.ChannelFailureException;
import com.travelease.formapi.domain.exception.ConfigurationException;
import com.travelease.formapi.domain.exception.MalformedRequestException;
import com.travelease.formapi.domain.exception.MissingFieldsException;
import com.travelease.formapi.domain.model.Channel;
import com.travelease.formapi.domain.model.DispatchOutcome;
import com.travelease.formapi.domain.model.DispatchReport;
import com.travelease.formapi.interfaces.rest.dto.ErrorResponse;
import com.travelease.formapi.interfaces.rest.dto.SubmissionResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResponseAggregator Tests")
class ResponseAggregatorTest {

    private final ResponseAggregator aggregator = new ResponseAggregator();

    @Nested
    @DisplayName("Success responses")
    class SuccessTests {

        @Test
        @DisplayName("should map channel references onto the response fields")
        void testSuccess_References() {
            DispatchReport report = DispatchReport.of(TestFixtures.submission(), List.of(
                    DispatchOutcome.succeeded(Channel.QUEUE, "sqs-1"),
                    DispatchOutcome.succeeded(Channel.STORE, TestFixtures.SUBMISSION_ID.toString()),
                    DispatchOutcome.succeeded(Channel.CUSTOMER_EMAIL, "ses-c"),
                    DispatchOutcome.succeeded(Channel.OWNER_EMAIL, "ses-o"),
                    DispatchOutcome.skipped(Channel.BUSINESS_EMAIL),
                    DispatchOutcome.succeeded(Channel.BROADCAST, "sns-1")));

            ResponseEntity<Object> response = aggregator.success(report);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
            assertThat(response.getBody()).isEqualTo(new SubmissionResponse(
                    "Form submitted successfully", TestFixtures.SUBMISSION_ID.toString(),
                    "ses-c", "ses-o", null, "sqs-1", "sns-1", List.of()));
        }

        @Test
        @DisplayName("should list failed channels and null their references")
        void testSuccess_FailedChannels() {
            DispatchReport report = DispatchReport.of(TestFixtures.submission(), List.of(
                    DispatchOutcome.skipped(Channel.QUEUE),
                    DispatchOutcome.failed(Channel.OWNER_EMAIL, new RuntimeException("Throttling")),
                    DispatchOutcome.succeeded(Channel.CUSTOMER_EMAIL, "ses-c")));

            SubmissionResponse body = (SubmissionResponse) aggregator.success(report).getBody();

            assertThat(body.ownerSesMessageId()).isNull();
            assertThat(body.sqsMessageId()).isNull();
            assertThat(body.snsMessageId()).isNull();
            assertThat(body.failedChannels()).containsExactly("owner_email");
        }
    }

    @Nested
    @DisplayName("Failure responses")
    class FailureTests {

        @Test
        @DisplayName("should map missing fields to 400")
        void testFailure_MissingFields() {
            ResponseEntity<Object> response = aggregator.failure(new MissingFieldsException(List.of("email")));

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(response.getBody()).isEqualTo(new ErrorResponse("Missing required fields: email"));
        }

        @Test
        @DisplayName("should map a malformed request to 400")
        void testFailure_Malformed() {
            ResponseEntity<Object> response = aggregator.failure(new MalformedRequestException("Request body is required."));

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(response.getBody()).isEqualTo(new ErrorResponse("Request body is required."));
        }

        @Test
        @DisplayName("should map a channel failure to 500 with the raw error text")
        void testFailure_Channel() {
            ResponseEntity<Object> response = aggregator.failure(
                    new ChannelFailureException(Channel.CUSTOMER_EMAIL, new RuntimeException("SES is down")));

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
            assertThat(response.getBody()).isEqualTo(new ErrorResponse("SES is down"));
        }

        @Test
        @DisplayName("should map a configuration error to 500")
        void testFailure_Configuration() {
            ResponseEntity<Object> response = aggregator.failure(new ConfigurationException("Sender email address is not configured."));

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
            assertThat(response.getBody()).isEqualTo(new ErrorResponse("Sender email address is not configured."));
        }

        @Test
        @DisplayName("should fall back to the exception type when there is no message")
        void testFailure_NoMessage() {
            ResponseEntity<Object> response = aggregator.failure(new IllegalStateException());

            assertThat(response.getBody()).isEqualTo(new ErrorResponse("java.lang.IllegalStateException"));
        }
    }
}
