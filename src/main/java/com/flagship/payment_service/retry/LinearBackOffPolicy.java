package com.flagship.payment_service.retry;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

/**
 * Back-off that waits {@code baseDelay * n} after the n-th failed attempt.
 *
 * Spring Retry ships fixed and exponential policies only.
 */
class LinearBackOffPolicy implements BackOffPolicy {

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    LinearBackOffPolicy(RetryPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new LinearBackOffContext();
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        LinearBackOffContext context = (LinearBackOffContext) backOffContext;
        context.failedAttempts++;
        long delayMillis = policy.delayAfterAttempt(context.failedAttempts).toMillis();
        try {
            sleeper.sleep(delayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Thread interrupted while sleeping", e);
        }
    }

    private static final class LinearBackOffContext implements BackOffContext {
        private int failedAttempts;
    }
}
