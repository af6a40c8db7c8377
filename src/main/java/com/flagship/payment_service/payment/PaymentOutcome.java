package com.flagship.payment_service.payment;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Terminal result of a decided payment request, stored under the request id.
 *
 * Write-once: the first outcome stored for an id wins and is never changed
 * by reprocessing.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaymentOutcome {

    @JsonProperty("id")
    String id;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("message")
    String message;

    @JsonProperty("processed_at")
    Instant processedAt;

    /**
     * Creates the outcome for a decision, with the standard message for its status.
     */
    public static PaymentOutcome of(String id, PaymentStatus status, String transactionId, Instant processedAt) {
        return PaymentOutcome.builder()
                .id(id)
                .status(status)
                .transactionId(transactionId)
                .message(messageFor(status))
                .processedAt(processedAt)
                .build();
    }

    @JsonIgnore
    public boolean isApproved() {
        return status == PaymentStatus.APPROVED;
    }

    private static String messageFor(PaymentStatus status) {
        return switch (status) {
            case APPROVED -> "Payment processed successfully";
            case REJECTED -> "Payment rejected";
            case FAILED -> "Payment failed";
        };
    }
}
