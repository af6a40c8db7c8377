package com.flagship.payment_service.payment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payment_service.payment.PaymentOutcome;
import com.flagship.payment_service.payment.ProcessingResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Response DTO for direct payment processing.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProcessPaymentResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("status")
    String status;

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("message")
    String message;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("processed_at")
    Instant processedAt;

    @JsonProperty("duplicate")
    boolean duplicate;

    @JsonProperty("event_published")
    boolean eventPublished;

    /**
     * Creates the response from a processing result.
     * Requests that never reached a decision report status "failed" and the event's transaction id.
     */
    public static ProcessPaymentResponse from(ProcessingResult result) {
        PaymentOutcome outcome = result.getOutcome();
        if (outcome != null) {
            return ProcessPaymentResponse.builder()
                .id(outcome.getId())
                .status(outcome.getStatus().wireValue())
                .transactionId(outcome.getTransactionId())
                .message(outcome.getMessage())
                .reason(result.getFailureReason())
                .processedAt(outcome.getProcessedAt())
                .duplicate(result.isDuplicate())
                .eventPublished(result.isEventPublished())
                .build();
        }

        return ProcessPaymentResponse.builder()
            .id(result.getRequestId())
            .status("failed")
            .transactionId(result.getEvent().getTransactionId())
            .message("Payment could not be processed")
            .reason(result.getFailureReason())
            .eventPublished(result.isEventPublished())
            .build();
    }
}
