package com.travelease.formapi.domain.port;

import com.travelease.formapi.domain.model.OutboundEmail;
import reactor.core.publisher.Mono;

public interface EmailSender {

    /**
     * @return the provider message id
     */
    Mono<String> send(OutboundEmail email);
}
