package com.travelease.formapi.infrastructure.notification;

import com.travelease.formapi.domain.model.OutboundEmail;
import com.travelease.formapi.domain.port.EmailSender;
import com.travelease.formapi.infrastructure.exception.InfrastructureException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.ses.SesAsyncClient;
import software.amazon.awssdk.services.ses.model.Body;
import software.amazon.awssdk.services.ses.model.Content;
import software.amazon.awssdk.services.ses.model.Destination;
import software.amazon.awssdk.services.ses.model.Message;
import software.amazon.awssdk.services.ses.model.SendEmailRequest;
import software.amazon.awssdk.services.ses.model.SendEmailResponse;

import java.nio.charset.StandardCharsets;

@Component
public class SesEmailSender implements EmailSender {

    private static final Logger logger = LoggerFactory.getLogger(SesEmailSender.class);
    private static final String CHARSET = StandardCharsets.UTF_8.name();

    private final SesAsyncClient sesAsyncClient;
    private final CircuitBreaker emailCircuitBreaker;

    public SesEmailSender(SesAsyncClient sesAsyncClient,
                          @Qualifier("emailCircuitBreaker") CircuitBreaker emailCircuitBreaker) {
        this.sesAsyncClient = sesAsyncClient;
        this.emailCircuitBreaker = emailCircuitBreaker;
    }

    @Override
    public Mono<String> send(OutboundEmail email) {
        return Mono.fromCallable(() -> toRequest(email))
                .flatMap(request -> Mono.fromFuture(sesAsyncClient.sendEmail(request)))
                .map(SendEmailResponse::messageId)
                .doOnSuccess(messageId -> logger.debug("Email sent via SES, messageId: {}", messageId))
                .doOnError(e -> logger.error("Failed to send email via SES, error: {}", e.getMessage()))
                .onErrorMap(e -> InfrastructureException.wrap("SES", e))
                .transformDeferred(CircuitBreakerOperator.of(emailCircuitBreaker));
    }

    SendEmailRequest toRequest(OutboundEmail email) {
        SendEmailRequest.Builder builder = SendEmailRequest.builder()
                .source(email.source())
                .destination(Destination.builder().toAddresses(email.recipient()).build())
                .message(Message.builder()
                        .subject(content(email.content().subject()))
                        .body(Body.builder()
                                .text(content(email.content().text()))
                                .html(content(email.content().html()))
                                .build())
                        .build());

        if (email.configurationSet() != null) {
            builder.configurationSetName(email.configurationSet());
        }
        return builder.build();
    }

    private static Content content(String data) {
        return Content.builder().data(data).charset(CHARSET).build();
    }
}
