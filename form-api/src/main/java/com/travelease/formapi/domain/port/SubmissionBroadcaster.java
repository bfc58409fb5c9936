package com.travelease.formapi.domain.port;

import reactor.core.publisher.Mono;

public interface SubmissionBroadcaster {

    /**
     * @return the message id assigned by the topic
     */
    Mono<String> publish(String topicArn, String subject, String message);
}
