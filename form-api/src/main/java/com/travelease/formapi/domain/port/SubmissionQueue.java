package com.travelease.formapi.domain.port;

import reactor.core.publisher.Mono;

public interface SubmissionQueue {

    /**
     * Sends one message to the queue.
     *
     * @return the queue-assigned message id
     */
    Mono<String> enqueue(String queueUrl, String messageBody);
}
