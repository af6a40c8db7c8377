package com.flagship.payment_service.retry;

import lombok.Value;

/**
 * Result of a retried operation: either it succeeded within the allowed
 * attempts or the attempts were exhausted.
 */
@Value
public class RetryResult {

    boolean succeeded;
    int attempts;
    Throwable lastError;

    public static RetryResult succeeded(int attempts) {
        return new RetryResult(true, attempts, null);
    }

    public static RetryResult exhausted(int attempts, Throwable lastError) {
        return new RetryResult(false, attempts, lastError);
    }

    public boolean isExhausted() {
        return !succeeded;
    }
}
