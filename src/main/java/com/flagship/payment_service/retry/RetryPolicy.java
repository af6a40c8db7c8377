package com.flagship.payment_service.retry;

import lombok.Value;

import java.time.Duration;

/**
 * Bounded retry with attempt-proportional back-off.
 *
 * The wait before attempt n+1 is {@code baseDelay * n}.
 */
@Value
public class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);

    int maxAttempts;
    Duration baseDelay;

    public RetryPolicy(int maxAttempts, Duration baseDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be zero or positive");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY);
    }

    /**
     * Delay to wait after the given (1-based) failed attempt.
     */
    public Duration delayAfterAttempt(int attempt) {
        return baseDelay.multipliedBy(attempt);
    }
}
