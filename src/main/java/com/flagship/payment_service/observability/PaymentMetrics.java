package com.flagship.payment_service.observability;

import com.flagship.payment_service.payment.PaymentStatus;
import com.flagship.payment_service.retry.RetryResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for payment processing.
 *
 * Metrics exposed:
 * - payment.requests.received: Counter of requests entering the pipeline
 * - payment.outcomes: Counter of decided payments, tagged by status
 * - payment.failures: Counter of requests ending without an outcome, tagged by stage
 * - payment.duplicate_requests: Counter of requests answered from the stored outcome
 * - payment.publish.attempts: Counter of publish attempts, tagged by topic
 * - payment.publish.exhausted: Counter of events given up after all retries, tagged by topic
 * - payment.processing.duration: Timer of the whole pipeline, tagged by result
 */
@Component
public class PaymentMetrics {

    private final MeterRegistry registry;

    private final Counter requestsReceived;
    private final Counter duplicateRequests;

    public PaymentMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.requestsReceived = Counter.builder("payment.requests.received")
                .description("Number of payment requests received")
                .register(registry);

        this.duplicateRequests = Counter.builder("payment.duplicate_requests")
                .description("Number of payment requests answered from an already stored outcome")
                .register(registry);
    }

    public void recordRequestReceived() {
        requestsReceived.increment();
    }

    public void recordDuplicateRequest() {
        duplicateRequests.increment();
    }

    /**
     * Records a decided payment.
     * Uses registry.counter() for efficient meter lookup/creation.
     */
    public void recordOutcome(PaymentStatus status) {
        registry.counter("payment.outcomes", "status", status.wireValue()).increment();
    }

    /**
     * Records a request that terminated without an outcome.
     */
    public void recordFailure(String stage) {
        registry.counter("payment.failures", "stage", sanitizeTag(stage)).increment();
    }

    /**
     * Records the attempts spent on publishing one event and whether it got through.
     */
    public void recordPublish(String topic, RetryResult result) {
        registry.counter("payment.publish.attempts", "topic", sanitizeTag(topic))
                .increment(result.getAttempts());
        if (result.isExhausted()) {
            registry.counter("payment.publish.exhausted", "topic", sanitizeTag(topic)).increment();
        }
    }

    public void recordProcessingDuration(Duration duration, boolean success) {
        Timer.builder("payment.processing.duration")
                .description("Time from receiving a payment request to its terminal event")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(duration);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        // Limit length and remove special characters
        String sanitized = value.replaceAll("[^a-zA-Z0-9_-]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
