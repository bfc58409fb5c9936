package com.travelease.formapi.infrastructure.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * One circuit breaker per collaborator and the rate limiter guarding the submit endpoint.
 * No retry is applied: each channel call is attempted at most once per request.
 */
@Configuration
public class ResilienceConfig {

    @Bean(name = "queueCircuitBreaker")
    public CircuitBreaker queueCircuitBreaker() {
        return circuitBreaker("queueCircuitBreaker", 20, Duration.ofSeconds(30));
    }

    @Bean(name = "storeCircuitBreaker")
    public CircuitBreaker storeCircuitBreaker() {
        return circuitBreaker("storeCircuitBreaker", 10, Duration.ofSeconds(15));
    }

    @Bean(name = "emailCircuitBreaker")
    public CircuitBreaker emailCircuitBreaker() {
        return circuitBreaker("emailCircuitBreaker", 20, Duration.ofSeconds(30));
    }

    @Bean(name = "broadcastCircuitBreaker")
    public CircuitBreaker broadcastCircuitBreaker() {
        return circuitBreaker("broadcastCircuitBreaker", 20, Duration.ofSeconds(30));
    }

    @Bean(name = "submissionRateLimiter")
    public RateLimiter submissionRateLimiter(SubmissionProperties submissionProperties) {
        SubmissionProperties.RateLimit rateLimit = submissionProperties.rateLimit();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(rateLimit.limitForPeriod())
                .limitRefreshPeriod(rateLimit.refreshPeriod())
                .timeoutDuration(rateLimit.timeout())
                .build();
        return RateLimiter.of("submissionRateLimiter", config);
    }

    private CircuitBreaker circuitBreaker(String name, int slidingWindowSize, Duration waitInOpenState) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowSize(slidingWindowSize)
                .failureRateThreshold(50)
                .waitDurationInOpenState(waitInOpenState)
                .permittedNumberOfCallsInHalfOpenState(5)
                .build();
        return CircuitBreaker.of(name, config);
    }
}
