package com.flagship.payment_service.payment.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payment_service.messaging.Topics;
import com.flagship.payment_service.payment.PaymentOutcome;
import com.flagship.payment_service.payment.PaymentRequest;
import com.flagship.payment_service.payment.PaymentStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published on payment-failed.
 *
 * Covers every request that did not end approved: validation failures,
 * declined or failed decisions, timeouts and processing errors. Consumers
 * (billing) use it to compensate, so identifiers are always filled in,
 * falling back to "unknown" when the request did not carry them.
 */
@Value
public class PaymentFailedEvent implements PaymentEvent {

    public static final String STATUS = "failed";
    public static final String UNKNOWN = "unknown";

    public static final String REJECTED_REASON = "Payment rejected by payment processor";
    public static final String REJECTED_DETAILS = "Insufficient funds or card declined";
    public static final String FAILED_REASON = "Payment failed at payment processor";

    @JsonProperty("invoice_id")
    String invoiceId;

    @JsonProperty("order_id")
    String orderId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("customer_id")
    String customerId;

    @JsonProperty("product_id")
    String productId;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("error_details")
    String errorDetails;

    @JsonProperty("failed_at")
    Instant failedAt;

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("status")
    public String getStatus() {
        return STATUS;
    }

    @Override
    @JsonIgnore
    public String getTopic() {
        return Topics.PAYMENT_FAILED;
    }

    /**
     * Creates the event for a request whose decision was not an approval.
     * Carries the stored outcome's transaction id.
     */
    public static PaymentFailedEvent declined(PaymentRequest request, PaymentOutcome outcome) {
        boolean rejected = outcome.getStatus() == PaymentStatus.REJECTED;
        return build(
            request,
            rejected ? REJECTED_REASON : FAILED_REASON,
            rejected ? REJECTED_DETAILS : outcome.getMessage(),
            outcome.getTransactionId(),
            outcome.getProcessedAt()
        );
    }

    /**
     * Creates the event for a request that could not produce an outcome.
     * A fresh transaction id is generated so the failure can be traced.
     *
     * @param request The request, possibly null or incomplete
     * @param reason Short machine-readable reason
     * @param errorDetails Human-readable detail
     * @param failedAt When processing gave up
     */
    public static PaymentFailedEvent failure(PaymentRequest request, String reason,
                                             String errorDetails, Instant failedAt) {
        return build(request, reason, errorDetails, UUID.randomUUID().toString(), failedAt);
    }

    private static PaymentFailedEvent build(PaymentRequest request, String reason, String errorDetails,
                                            String transactionId, Instant failedAt) {
        String invoiceId = request != null ? firstPresent(request.getId(), request.getOrderId()) : UNKNOWN;
        String orderId = request != null ? firstPresent(request.getOrderId(), request.getId()) : UNKNOWN;
        BigDecimal amount = request != null && request.getAmount() != null ? request.getAmount() : BigDecimal.ZERO;
        String customerId = request != null ? firstPresent(request.getCustomerId()) : UNKNOWN;
        String productId = request != null ? firstPresent(request.getProductId()) : UNKNOWN;

        return new PaymentFailedEvent(
            invoiceId,
            orderId,
            amount,
            customerId,
            productId,
            reason,
            errorDetails,
            failedAt,
            transactionId
        );
    }

    private static String firstPresent(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return UNKNOWN;
    }
}
