package com.flagship.payment_service.retry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an operation with bounded retries and linear back-off.
 *
 * Exhaustion is reported through the returned {@link RetryResult}, never
 * thrown: the caller decides what an exhausted operation means. Intended for
 * network-fallible calls such as event publication, not for writes that must
 * fail fast.
 *
 * Usage:
 * <pre>
 * RetryResult result = retryExecutor.execute("publish payment-completed",
 *     () -> eventPublisher.publish(topic, key, event));
 * if (result.isExhausted()) {
 *     // report, do not reprocess
 * }
 * </pre>
 */
@Slf4j
public class RetryExecutor {

    private final RetryPolicy defaultPolicy;
    private final Sleeper sleeper;

    public RetryExecutor(RetryPolicy defaultPolicy) {
        this(defaultPolicy, new ThreadWaitSleeper());
    }

    public RetryExecutor(RetryPolicy defaultPolicy, Sleeper sleeper) {
        this.defaultPolicy = defaultPolicy;
        this.sleeper = sleeper;
    }

    /**
     * Executes with the default policy.
     */
    public RetryResult execute(String operationName, RetryableOperation operation) {
        return execute(operationName, operation, defaultPolicy);
    }

    /**
     * Executes an operation up to {@code policy.maxAttempts} times.
     *
     * @param operationName Name used in log messages
     * @param operation The operation; any exception counts as a failed attempt
     * @param policy Attempts and base delay
     * @return Succeeded with the attempt count, or exhausted with the last error
     */
    public RetryResult execute(String operationName, RetryableOperation operation, RetryPolicy policy) {
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(policy.getMaxAttempts()));
        template.setBackOffPolicy(new LinearBackOffPolicy(policy, sleeper));

        AtomicInteger attempts = new AtomicInteger();

        try {
            return template.execute(context -> {
                int attempt = attempts.incrementAndGet();
                try {
                    operation.run();
                } catch (Exception e) {
                    if (attempt < policy.getMaxAttempts()) {
                        log.warn("{} failed on attempt {}/{}, retrying in {}ms: {}",
                                operationName, attempt, policy.getMaxAttempts(),
                                policy.delayAfterAttempt(attempt).toMillis(), e.getMessage());
                    }
                    throw e;
                }
                if (attempt > 1) {
                    log.info("{} succeeded on attempt {}", operationName, attempt);
                }
                return RetryResult.succeeded(attempt);
            }, context -> {
                Throwable lastError = context.getLastThrowable();
                log.error("{} failed after {} attempts: {}",
                        operationName, attempts.get(), lastError != null ? lastError.getMessage() : "unknown");
                return RetryResult.exhausted(attempts.get(), lastError);
            });

        } catch (BackOffInterruptedException e) {
            log.warn("{} interrupted during back-off after {} attempts", operationName, attempts.get());
            return RetryResult.exhausted(attempts.get(), e);
        } catch (Exception e) {
            // Only reachable if the recovery callback itself fails
            log.error("{} aborted after {} attempts", operationName, attempts.get(), e);
            return RetryResult.exhausted(attempts.get(), e);
        }
    }

    /**
     * An operation that may fail with any exception.
     */
    @FunctionalInterface
    public interface RetryableOperation {
        void run() throws Exception;
    }
}
