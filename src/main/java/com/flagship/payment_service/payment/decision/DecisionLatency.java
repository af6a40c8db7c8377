package com.flagship.payment_service.payment.decision;

import com.flagship.payment_service.payment.PaymentRequest;

import java.time.Duration;

/**
 * How long the simulated payment network takes to answer.
 */
@FunctionalInterface
public interface DecisionLatency {

    /**
     * Blocks for the simulated network delay of a request.
     *
     * @throws InterruptedException if the wait is cancelled
     */
    void await(PaymentRequest request) throws InterruptedException;

    /**
     * No delay at all, for tests and local runs.
     */
    static DecisionLatency none() {
        return request -> { };
    }

    /**
     * A fixed delay, or none when the duration is zero.
     */
    static DecisionLatency fixed(Duration delay) {
        return delay.isZero() || delay.isNegative() ? none() : new FixedDecisionLatency(delay);
    }
}
