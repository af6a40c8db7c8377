package com.flagship.payment_service.payment;

import com.flagship.payment_service.messaging.EventPublisher;
import com.flagship.payment_service.observability.CorrelationContext;
import com.flagship.payment_service.observability.PaymentMetrics;
import com.flagship.payment_service.payment.decision.PaymentDecisionGateway;
import com.flagship.payment_service.payment.event.PaymentCompletedEvent;
import com.flagship.payment_service.payment.event.PaymentEvent;
import com.flagship.payment_service.payment.event.PaymentFailedEvent;
import com.flagship.payment_service.retry.RetryExecutor;
import com.flagship.payment_service.retry.RetryResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives a payment request through validation, decision, persistence and
 * publication of its terminal event.
 *
 * Guarantees:
 * - Every request ends with exactly one published (or attempted) terminal event,
 *   payment-completed for approvals and payment-failed for everything else.
 * - Invalid requests never touch the state store.
 * - An outcome already stored for the request id is reused, not recomputed,
 *   so redelivered requests keep their original transaction id. Concurrent
 *   deliveries race on a conditional write and all publish the winner's outcome.
 * - A decision that does not arrive within the processing timeout is cancelled
 *   and reported as a failure.
 * - Publication is retried with linear back-off; exhaustion is logged and
 *   reported in the result, the stored outcome stays as it is.
 *
 * {@link #process(PaymentRequest)} never throws.
 */
@Slf4j
public class PaymentProcessor {

    static final String TIMEOUT_REASON_PREFIX = "processing timeout: no decision within ";
    static final String ERROR_REASON_PREFIX = "processing error: ";
    static final String VALIDATION_DETAILS_PREFIX = "Payment validation failed: ";
    static final String MALFORMED_REASON = "malformed payment request";

    private final PaymentValidator validator;
    private final PaymentDecisionGateway decisionGateway;
    private final PaymentOutcomeStore outcomeStore;
    private final EventPublisher eventPublisher;
    private final RetryExecutor retryExecutor;
    private final ExecutorService decisionExecutor;
    private final Duration processingTimeout;
    private final Clock clock;
    private final PaymentMetrics metrics;

    public PaymentProcessor(PaymentValidator validator,
                            PaymentDecisionGateway decisionGateway,
                            PaymentOutcomeStore outcomeStore,
                            EventPublisher eventPublisher,
                            RetryExecutor retryExecutor,
                            ExecutorService decisionExecutor,
                            Duration processingTimeout,
                            Clock clock,
                            PaymentMetrics metrics) {
        this.validator = validator;
        this.decisionGateway = decisionGateway;
        this.outcomeStore = outcomeStore;
        this.eventPublisher = eventPublisher;
        this.retryExecutor = retryExecutor;
        this.decisionExecutor = decisionExecutor;
        this.processingTimeout = processingTimeout;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Processes one payment request to its terminal event.
     *
     * @param request The request as received, possibly incomplete
     * @return What happened, including the event and whether it was published
     */
    public ProcessingResult process(PaymentRequest request) {
        long startNanos = System.nanoTime();
        String requestId = request != null ? request.getId() : null;

        CorrelationContext.setRequestId(requestId);
        metrics.recordRequestReceived();
        log.info("Processing payment request: id={}, order={}, amount={}",
                requestId,
                request != null ? request.getOrderId() : null,
                request != null ? request.getAmount() : null);

        try {
            ProcessingResult result = run(request);
            metrics.recordProcessingDuration(Duration.ofNanos(System.nanoTime() - startNanos), result.isSuccess());
            log.info("Payment request {} finished: success={}, stage={}, eventPublished={}",
                    requestId, result.isSuccess(), result.getStage(), result.isEventPublished());
            return result;
        } finally {
            CorrelationContext.clearRequestId();
        }
    }

    /**
     * Reports a payload that could not be read as a payment request.
     * Publishes a payment-failed event with unknown identifiers.
     *
     * @param detail Why the payload could not be read
     */
    public ProcessingResult rejectMalformed(String detail) {
        log.warn("Malformed payment request: {}", detail);
        metrics.recordRequestReceived();
        metrics.recordFailure(ProcessingState.RECEIVED.label());

        PaymentFailedEvent event = PaymentFailedEvent.failure(null, MALFORMED_REASON, detail, clock.instant());
        boolean published = publish(event.getInvoiceId(), event);
        return ProcessingResult.failed(null, ProcessingState.RECEIVED, event, published, MALFORMED_REASON);
    }

    private ProcessingResult run(PaymentRequest request) {
        ProcessingState stage = ProcessingState.VALIDATING;

        ValidationResult validation = validator.validate(request);
        if (validation.isRejected()) {
            String reason = validation.getReason();
            log.warn("Payment request rejected by validation: {}", reason);
            return fail(request, stage, reason, VALIDATION_DETAILS_PREFIX + reason);
        }

        String requestId = request.getId();

        try {
            stage = ProcessingState.DECIDING;
            Optional<PaymentOutcome> existing = outcomeStore.find(requestId);
            boolean duplicate = existing.isPresent();

            PaymentOutcome outcome;
            if (duplicate) {
                outcome = existing.get();
                metrics.recordDuplicateRequest();
                log.info("Payment {} already processed with status {}, reusing transaction {}",
                        requestId, outcome.getStatus(), outcome.getTransactionId());
            } else {
                PaymentStatus status = decide(request);

                stage = ProcessingState.PERSISTING;
                PaymentOutcome decided = PaymentOutcome.of(requestId, status, UUID.randomUUID().toString(), clock.instant());
                outcome = outcomeStore.saveIfAbsent(decided);
                if (outcome == decided) {
                    metrics.recordOutcome(status);
                    log.info("Payment {} decided: status={}, transaction={}",
                            requestId, status, outcome.getTransactionId());
                } else {
                    // a concurrent delivery stored its outcome first
                    duplicate = true;
                    metrics.recordDuplicateRequest();
                }
            }

            stage = ProcessingState.PUBLISHING;
            PaymentEvent event;
            String failureReason = null;
            if (outcome.isApproved()) {
                event = PaymentCompletedEvent.from(request, outcome);
            } else {
                PaymentFailedEvent failed = PaymentFailedEvent.declined(request, outcome);
                failureReason = failed.getReason();
                event = failed;
            }

            boolean published = publish(requestId, event);
            return ProcessingResult.decided(requestId, outcome, event, published, duplicate, failureReason);

        } catch (TimeoutException e) {
            String reason = TIMEOUT_REASON_PREFIX + processingTimeout.toMillis() + "ms";
            log.warn("Payment {} timed out waiting for a decision", requestId);
            return fail(request, stage, reason,
                    "No decision from payment network within " + processingTimeout.toMillis() + "ms");

        } catch (InterruptedException e) {
            log.warn("Payment {} interrupted during {}", requestId, stage.label());
            // the flag must be clear while publishing, blocking sends and back-off abort on it
            ProcessingResult result = fail(request, stage, ERROR_REASON_PREFIX + "interrupted", detailsFor(e, stage));
            Thread.currentThread().interrupt();
            return result;

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Payment {} failed during {}: {}", requestId, stage.label(), cause.getMessage(), cause);
            return fail(request, stage, ERROR_REASON_PREFIX + cause.getMessage(), detailsFor(cause, stage));

        } catch (Exception e) {
            log.error("Payment {} failed during {}: {}", requestId, stage.label(), e.getMessage(), e);
            return fail(request, stage, ERROR_REASON_PREFIX + e.getMessage(), detailsFor(e, stage));
        }
    }

    /**
     * Asks the gateway for a decision on the decision executor, bounded by the processing timeout.
     * The decision task runs with the caller's MDC and is interrupted when the timeout elapses.
     */
    private PaymentStatus decide(PaymentRequest request)
            throws InterruptedException, ExecutionException, TimeoutException {
        Future<PaymentStatus> decision = decisionExecutor.submit(
                CorrelationContext.propagate(() -> decisionGateway.decide(request)));
        try {
            return decision.get(processingTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            decision.cancel(true);
            throw e;
        }
    }

    private ProcessingResult fail(PaymentRequest request, ProcessingState stage,
                                  String reason, String errorDetails) {
        metrics.recordFailure(stage.label());
        PaymentFailedEvent event = PaymentFailedEvent.failure(request, reason, errorDetails, clock.instant());
        boolean published = publish(event.getInvoiceId(), event);
        return ProcessingResult.failed(request != null ? request.getId() : null, stage, event, published, reason);
    }

    /**
     * Publishes a terminal event with retries.
     *
     * @return false if every attempt failed
     */
    private boolean publish(String key, PaymentEvent event) {
        String topic = event.getTopic();
        RetryResult result = retryExecutor.execute("publish " + topic,
                () -> eventPublisher.publish(topic, key, event));
        metrics.recordPublish(topic, result);

        if (result.isExhausted()) {
            log.error("Giving up on {} event for {} after {} attempts",
                    topic, event.getInvoiceId(), result.getAttempts());
            return false;
        }
        log.info("Published {} event for {}", topic, event.getInvoiceId());
        return true;
    }

    private static String detailsFor(Throwable error, ProcessingState stage) {
        return error.getClass().getSimpleName() + " during " + stage.label();
    }
}
