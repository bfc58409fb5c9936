package com.travelease.formapi.infrastructure.metrics;

import com.travelease.formapi.domain.model.Channel;
import com.travelease.formapi.domain.model.DispatchOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class MetricsPublisher {

    private final MeterRegistry meterRegistry;

    public MetricsPublisher(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void incrementSubmission(String status) {
        meterRegistry.counter("submission.count", "status", status).increment();
    }

    public void incrementChannelDispatch(Channel channel, DispatchOutcome.Status outcome) {
        meterRegistry.counter("channel.dispatch.count",
                "channel", channel.tag(),
                "outcome", outcome.name().toLowerCase(Locale.ROOT)).increment();
    }

    public void incrementRateLimit() {
        meterRegistry.counter("api.rate_limit.count").increment();
    }
}
