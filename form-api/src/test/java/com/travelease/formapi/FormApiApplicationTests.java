package com.travelease.formapi;

import com.travelease.formapi.domain.model.DispatchSettings;
import com.travelease.formapi.domain.model.OutboundEmail;
import com.travelease.formapi.domain.port.EmailSender;
import com.travelease.formapi.domain.port.SubmissionBroadcaster;
import com.travelease.formapi.domain.port.SubmissionQueue;
import com.travelease.formapi.domain.port.SubmissionStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@DisplayName("Form API application Tests")
class FormApiApplicationTests {

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private DispatchSettings dispatchSettings;

    @MockBean
    private SubmissionQueue submissionQueue;

    @MockBean
    private SubmissionStore submissionStore;

    @MockBean
    private EmailSender emailSender;

    @MockBean
    private SubmissionBroadcaster submissionBroadcaster;

    @Test
    @DisplayName("should bind dispatch settings from configuration")
    void testContext_BindsDispatchSettings() {
        assertThat(dispatchSettings.sourceEmail()).isEqualTo("sender@travelease.test");
        assertThat(dispatchSettings.resolvedOwnerEmail()).isEqualTo("owner@travelease.test");
        assertThat(dispatchSettings.distinctBusinessEmail()).isNull();
        assertThat(dispatchSettings.queueUrl()).endsWith("/travelease-form");
        assertThat(dispatchSettings.executionMode()).isEqualTo(DispatchSettings.ExecutionMode.SEQUENTIAL);
        assertThat(dispatchSettings.failureMode()).isEqualTo(DispatchSettings.FailureMode.FAIL_FAST);
    }

    @Test
    @DisplayName("should accept a submission end to end")
    void testSubmit_EndToEnd() {
        when(submissionQueue.enqueue(anyString(), anyString())).thenReturn(Mono.just("sqs-1"));
        when(submissionStore.put(anyString(), any())).thenReturn(Mono.empty());
        when(emailSender.send(any(OutboundEmail.class))).thenReturn(Mono.just("ses-1"));
        when(submissionBroadcaster.publish(anyString(), anyString(), anyString())).thenReturn(Mono.just("sns-1"));

        webTestClient.post().uri("/submit")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"name\":\"A\",\"email\":\"a@x.com\",\"phone\":\"123\",\"inquiry_type\":\"Tour\",\"message\":\"Hi\"}")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_JSON)
                .expectBody()
                .jsonPath("$.message").isEqualTo("Form submitted successfully")
                .jsonPath("$.submission_id").isNotEmpty()
                .jsonPath("$.sqs_message_id").isEqualTo("sqs-1")
                .jsonPath("$.sns_message_id").isEqualTo("sns-1")
                .jsonPath("$.customer_ses_message_id").isEqualTo("ses-1")
                .jsonPath("$.owner_ses_message_id").isEqualTo("ses-1")
                .jsonPath("$.business_ses_message_id").isEmpty();

        ArgumentCaptor<OutboundEmail> emails = ArgumentCaptor.forClass(OutboundEmail.class);
        verify(emailSender, times(2)).send(emails.capture());
        assertThat(emails.getAllValues()).extracting(OutboundEmail::recipient)
                .containsExactly("a@x.com", "owner@travelease.test");
        verify(submissionStore).put(eq("travelease-form"), any());
    }

    @Test
    @DisplayName("should reject an incomplete submission before any channel runs")
    void testSubmit_MissingFields() {
        webTestClient.post().uri("/submit")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"name\":\"A\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Missing required fields: email, phone, inquiry_type, message");

        verify(submissionQueue, never()).enqueue(anyString(), anyString());
        verify(emailSender, never()).send(any(OutboundEmail.class));
    }
}
