package com.flagship.payment_service.payment.decision;

import com.flagship.payment_service.payment.PaymentRequest;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Sleeps for a fixed time in one-second steps, logging progress every five seconds.
 */
@Slf4j
class FixedDecisionLatency implements DecisionLatency {

    private static final long STEP_MILLIS = 1000;
    private static final long PROGRESS_EVERY_STEPS = 5;

    private final Duration delay;

    FixedDecisionLatency(Duration delay) {
        this.delay = delay;
    }

    @Override
    public void await(PaymentRequest request) throws InterruptedException {
        long remaining = delay.toMillis();
        long step = 0;

        log.info("Simulating {}ms payment network latency for request {}", remaining, request.getId());

        while (remaining > 0) {
            long sleep = Math.min(STEP_MILLIS, remaining);
            Thread.sleep(sleep);
            remaining -= sleep;
            step++;
            if (step % PROGRESS_EVERY_STEPS == 0 && remaining > 0) {
                log.info("Still waiting for payment network: {}ms elapsed, {}ms left",
                        delay.toMillis() - remaining, remaining);
            }
        }
    }
}
