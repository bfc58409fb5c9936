package com.travelease.formapi.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.travelease.formapi.domain.exception.ChannelFailureException;
import com.travelease.formapi.domain.exception.ConfigurationException;
import com.travelease.formapi.domain.model.Channel;
import com.travelease.formapi.domain.model.DispatchOutcome;
import com.travelease.formapi.domain.model.DispatchReport;
import com.travelease.formapi.domain.model.DispatchSettings;
import com.travelease.formapi.domain.model.DispatchSettings.ExecutionMode;
import com.travelease.formapi.domain.model.DispatchSettings.FailureMode;
import com.travelease.formapi.domain.model.EmailContent;
import com.travelease.formapi.domain.model.OutboundEmail;
import com.travelease.formapi.domain.model.Submission;
import com.travelease.formapi.domain.port.EmailSender;
import com.travelease.formapi.domain.port.SubmissionBroadcaster;
import com.travelease.formapi.domain.port.SubmissionQueue;
import com.travelease.formapi.domain.port.SubmissionStore;
import com.travelease.formapi.infrastructure.metrics.MetricsPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Supplier;

/**
 * Fans one {@link Submission} out to the queue, the store, the notification emails and the topic.
 *
 * <p>Each channel runs as an independent task that resolves to a {@link DispatchOutcome}; a
 * channel whose destination is not configured resolves to {@code skipped} without touching its
 * collaborator. {@link ExecutionMode} decides whether tasks run one after another or all at once,
 * {@link FailureMode} whether the first failed outcome aborts the dispatch or is only reported.
 */
@Service
public class SubmissionDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(SubmissionDispatcher.class);

    private final SubmissionQueue submissionQueue;
    private final SubmissionStore submissionStore;
    private final EmailSender emailSender;
    private final SubmissionBroadcaster submissionBroadcaster;
    private final NotificationComposer notificationComposer;
    private final ObjectMapper objectMapper;
    private final MetricsPublisher metricsPublisher;
    private final DispatchSettings settings;

    public SubmissionDispatcher(SubmissionQueue submissionQueue, SubmissionStore submissionStore,
                                EmailSender emailSender, SubmissionBroadcaster submissionBroadcaster,
                                NotificationComposer notificationComposer, ObjectMapper objectMapper,
                                MetricsPublisher metricsPublisher, DispatchSettings settings) {
        this.submissionQueue = submissionQueue;
        this.submissionStore = submissionStore;
        this.emailSender = emailSender;
        this.submissionBroadcaster = submissionBroadcaster;
        this.notificationComposer = notificationComposer;
        this.objectMapper = objectMapper;
        this.metricsPublisher = metricsPublisher;
        this.settings = settings;
    }

    public Mono<DispatchReport> dispatch(Submission submission) {
        if (settings.sourceEmail() == null) {
            return Mono.error(new ConfigurationException("Sender email address is not configured."));
        }

        List<Mono<DispatchOutcome>> tasks = List.of(
                enqueue(submission),
                persist(submission),
                notifyCustomer(submission),
                notifyOwner(submission),
                notifyBusiness(submission),
                broadcast(submission));

        boolean parallel = settings.executionMode() == ExecutionMode.PARALLEL;
        boolean failFast = settings.failureMode() == FailureMode.FAIL_FAST;

        Flux<DispatchOutcome> outcomes = parallel ? Flux.merge(tasks) : Flux.concat(tasks);

        // Parallel calls already in flight are never cancelled; a failure is raised once all have settled.
        if (failFast && !parallel) {
            outcomes = outcomes.<DispatchOutcome>handle((outcome, sink) -> {
                if (outcome.isFailed()) {
                    sink.error(abort(submission, outcome));
                } else {
                    sink.next(outcome);
                }
            });
        }

        return outcomes.collectList()
                .map(collected -> DispatchReport.of(submission, collected))
                .flatMap(report -> failFast && !report.failedChannels().isEmpty()
                        ? Mono.<DispatchReport>error(abort(submission, report.outcome(report.failedChannels().get(0))))
                        : Mono.just(report))
                .doOnSuccess(report -> logger.info("Dispatch finished, submissionId: {}, failed channels: {}",
                        submission.submissionId(), report.failedChannels()));
    }

    private ChannelFailureException abort(Submission submission, DispatchOutcome outcome) {
        logger.error("Aborting dispatch, submissionId: {}, failed channel: {}",
                submission.submissionId(), outcome.channel());
        return new ChannelFailureException(outcome.channel(), outcome.error());
    }

    private Mono<DispatchOutcome> enqueue(Submission submission) {
        if (settings.queueUrl() == null) {
            return skip(Channel.QUEUE, submission);
        }
        return attempt(Channel.QUEUE, submission, () -> serialize(submission)
                .flatMap(body -> submissionQueue.enqueue(settings.queueUrl(), body)));
    }

    private Mono<DispatchOutcome> persist(Submission submission) {
        if (settings.tableName() == null) {
            return skip(Channel.STORE, submission);
        }
        return attempt(Channel.STORE, submission, () -> submissionStore.put(settings.tableName(), submission)
                .thenReturn(submission.submissionId().toString()));
    }

    private Mono<DispatchOutcome> notifyCustomer(Submission submission) {
        return attempt(Channel.CUSTOMER_EMAIL, submission, () -> emailSender.send(
                email(submission.email(), notificationComposer.customerEmail(submission))));
    }

    private Mono<DispatchOutcome> notifyOwner(Submission submission) {
        return attempt(Channel.OWNER_EMAIL, submission, () -> emailSender.send(
                email(settings.resolvedOwnerEmail(), notificationComposer.ownerEmail(submission))));
    }

    private Mono<DispatchOutcome> notifyBusiness(Submission submission) {
        String businessEmail = settings.distinctBusinessEmail();
        if (businessEmail == null) {
            return skip(Channel.BUSINESS_EMAIL, submission);
        }
        return attempt(Channel.BUSINESS_EMAIL, submission, () -> emailSender.send(
                email(businessEmail, notificationComposer.ownerEmail(submission))));
    }

    private Mono<DispatchOutcome> broadcast(Submission submission) {
        if (settings.topicArn() == null) {
            return skip(Channel.BROADCAST, submission);
        }
        String subject = "TravelEase submission from " + submission.name();
        return attempt(Channel.BROADCAST, submission, () -> serialize(submission)
                .flatMap(body -> submissionBroadcaster.publish(settings.topicArn(), subject, body)));
    }

    private OutboundEmail email(String recipient, EmailContent content) {
        return new OutboundEmail(settings.sourceEmail(), recipient, content, settings.configurationSet());
    }

    private Mono<String> serialize(Submission submission) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(submission));
    }

    private Mono<DispatchOutcome> skip(Channel channel, Submission submission) {
        return Mono.fromCallable(() -> {
            logger.debug("Channel {} not configured, skipping, submissionId: {}", channel, submission.submissionId());
            metricsPublisher.incrementChannelDispatch(channel, DispatchOutcome.Status.SKIPPED);
            return DispatchOutcome.skipped(channel);
        });
    }

    // Deferred so that sequential execution only invokes a collaborator once its turn comes.
    private Mono<DispatchOutcome> attempt(Channel channel, Submission submission, Supplier<Mono<String>> call) {
        return Mono.defer(call)
                .map(referenceId -> DispatchOutcome.succeeded(channel, referenceId))
                .switchIfEmpty(Mono.fromSupplier(() -> DispatchOutcome.succeeded(channel, null)))
                .onErrorResume(e -> Mono.just(DispatchOutcome.failed(channel, e)))
                .doOnNext(outcome -> {
                    metricsPublisher.incrementChannelDispatch(channel, outcome.status());
                    if (outcome.isFailed()) {
                        logger.error("Channel {} failed, submissionId: {}, error: {}",
                                channel, submission.submissionId(), outcome.error().getMessage());
                    } else {
                        logger.info("Channel {} succeeded, submissionId: {}, reference: {}",
                                channel, submission.submissionId(), outcome.referenceId());
                    }
                });
    }
}
