package com.travelease.formapi.domain.model;

import java.util.Objects;

public record DispatchOutcome(
        Channel channel,
        Status status,
        String referenceId,
        Throwable error
) {
    public enum Status {
        SKIPPED,
        SUCCEEDED,
        FAILED
    }

    public DispatchOutcome {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(status, "status");
        if (status == Status.FAILED && error == null) {
            throw new IllegalArgumentException("Failed outcome requires an error");
        }
    }

    public static DispatchOutcome skipped(Channel channel) {
        return new DispatchOutcome(channel, Status.SKIPPED, null, null);
    }

    public static DispatchOutcome succeeded(Channel channel, String referenceId) {
        return new DispatchOutcome(channel, Status.SUCCEEDED, referenceId, null);
    }

    public static DispatchOutcome failed(Channel channel, Throwable error) {
        return new DispatchOutcome(channel, Status.FAILED, null, error);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
