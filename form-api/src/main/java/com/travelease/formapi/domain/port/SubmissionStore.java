package com.travelease.formapi.domain.port;

import com.travelease.formapi.domain.model.Submission;
import reactor.core.publisher.Mono;

public interface SubmissionStore {

    /**
     * Writes the submission as one record keyed by its submission id. Writing the same id again
     * replaces the record.
     */
    Mono<Void> put(String tableName, Submission submission);
}
