package com.flagship.payment_service.payment;

import com.flagship.payment_service.payment.event.PaymentEvent;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * What happened to one payment request.
 *
 * Every request produces exactly one terminal event, so {@code event} is never
 * null. {@code outcome} is present only when a decision was made (or reused).
 * {@code success} is true only for approved payments.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProcessingResult {

    String requestId;
    boolean success;
    ProcessingState stage;
    PaymentOutcome outcome;
    PaymentEvent event;
    boolean eventPublished;
    boolean duplicate;
    String failureReason;

    /**
     * Result of a request that reached a decision, whatever the decision was.
     */
    static ProcessingResult decided(String requestId, PaymentOutcome outcome, PaymentEvent event,
                                    boolean eventPublished, boolean duplicate, String failureReason) {
        return new ProcessingResult(
            requestId,
            outcome.isApproved(),
            ProcessingState.DONE,
            outcome,
            event,
            eventPublished,
            duplicate,
            failureReason
        );
    }

    /**
     * Result of a request that failed before an outcome could be produced.
     */
    static ProcessingResult failed(String requestId, ProcessingState stage, PaymentEvent event,
                                   boolean eventPublished, String failureReason) {
        return new ProcessingResult(requestId, false, stage, null, event, eventPublished, false, failureReason);
    }

    public boolean hasOutcome() {
        return outcome != null;
    }

    /**
     * True when the request was rejected by validation and never reached a decision.
     */
    public boolean isValidationFailure() {
        return stage == ProcessingState.VALIDATING;
    }
}
