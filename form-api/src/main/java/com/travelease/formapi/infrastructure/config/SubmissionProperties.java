package com.travelease.formapi.infrastructure.config;

import com.travelease.formapi.domain.model.DispatchSettings.ExecutionMode;
import com.travelease.formapi.domain.model.DispatchSettings.FailureMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "submission")
public record SubmissionProperties(
        Dispatch dispatch,
        RateLimit rateLimit
) {
    public SubmissionProperties {
        if (dispatch == null) {
            dispatch = new Dispatch(null, null);
        }
        if (rateLimit == null) {
            rateLimit = new RateLimit(0, null, null);
        }
    }

    public record Dispatch(
            ExecutionMode executionMode,
            FailureMode failureMode
    ) {
        public Dispatch {
            if (executionMode == null) {
                executionMode = ExecutionMode.SEQUENTIAL;
            }
            if (failureMode == null) {
                failureMode = FailureMode.FAIL_FAST;
            }
        }
    }

    public record RateLimit(
            int limitForPeriod,
            Duration refreshPeriod,
            Duration timeout
    ) {
        public RateLimit {
            if (limitForPeriod <= 0) {
                limitForPeriod = 50;
            }
            if (refreshPeriod == null) {
                refreshPeriod = Duration.ofSeconds(1);
            }
            if (timeout == null) {
                timeout = Duration.ZERO;
            }
        }
    }
}
