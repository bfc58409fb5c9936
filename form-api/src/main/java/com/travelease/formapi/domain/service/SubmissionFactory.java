package com.travelease.formapi.domain.service;

import com.travelease.formapi.domain.exception.MissingFieldsException;
import com.travelease.formapi.domain.model.Submission;
import com.travelease.formapi.domain.model.SubmissionRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Checks the required form fields and builds the canonical {@link Submission}.
 */
@Service
public class SubmissionFactory {

    public static final List<String> REQUIRED_FIELDS =
            List.of("name", "email", "phone", "inquiry_type", "message");

    private final Supplier<UUID> idGenerator;
    private final Clock clock;

    @Autowired
    public SubmissionFactory() {
        this(UUID::randomUUID, Clock.systemUTC());
    }

    public SubmissionFactory(Supplier<UUID> idGenerator, Clock clock) {
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    public SubmissionRequest validate(Map<String, Object> payload) {
        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            if (textOf(payload.get(field)) == null) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingFieldsException(missing);
        }
        return new SubmissionRequest(
                textOf(payload.get("name")),
                textOf(payload.get("email")),
                textOf(payload.get("phone")),
                textOf(payload.get("inquiry_type")),
                textOf(payload.get("message")));
    }

    public Submission build(Map<String, Object> payload) {
        SubmissionRequest request = validate(payload);
        return Submission.of(idGenerator.get(), request, Instant.now(clock));
    }

    // Only non-blank strings count as present; numbers, booleans and nested values do not.
    private static String textOf(Object value) {
        if (value instanceof String text && !text.isBlank()) {
            return text;
        }
        return null;
    }
}
