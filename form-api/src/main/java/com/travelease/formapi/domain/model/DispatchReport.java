package com.travelease.formapi.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcomes of one submission's dispatch, one per channel.
 */
public record DispatchReport(Submission submission, Map<Channel, DispatchOutcome> outcomes) {

    public DispatchReport {
        EnumMap<Channel, DispatchOutcome> copy = new EnumMap<>(Channel.class);
        copy.putAll(outcomes);
        outcomes = Collections.unmodifiableMap(copy);
    }

    public static DispatchReport of(Submission submission, List<DispatchOutcome> outcomes) {
        Map<Channel, DispatchOutcome> byChannel = new EnumMap<>(Channel.class);
        outcomes.forEach(outcome -> byChannel.put(outcome.channel(), outcome));
        return new DispatchReport(submission, byChannel);
    }

    public DispatchOutcome outcome(Channel channel) {
        return outcomes.getOrDefault(channel, DispatchOutcome.skipped(channel));
    }

    /** Reference id of a succeeded channel, {@code null} when skipped or failed. */
    public String referenceOf(Channel channel) {
        return outcome(channel).referenceId();
    }

    public List<Channel> failedChannels() {
        return outcomes.values().stream()
                .filter(DispatchOutcome::isFailed)
                .map(DispatchOutcome::channel)
                .toList();
    }
}
