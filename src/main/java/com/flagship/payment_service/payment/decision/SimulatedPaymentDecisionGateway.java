package com.flagship.payment_service.payment.decision;

import com.flagship.payment_service.payment.PaymentRequest;
import com.flagship.payment_service.payment.PaymentStatus;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.random.RandomGenerator;

/**
 * Stand-in for the external payment network.
 *
 * Amounts below the approval threshold are always approved. Amounts at or
 * above it are approved with a fixed probability and rejected otherwise.
 */
@Slf4j
public class SimulatedPaymentDecisionGateway implements PaymentDecisionGateway {

    private final BigDecimal approvalThreshold;
    private final double approvalProbability;
    private final RandomGenerator random;
    private final DecisionLatency latency;

    public SimulatedPaymentDecisionGateway(BigDecimal approvalThreshold, double approvalProbability,
                                           RandomGenerator random, DecisionLatency latency) {
        if (approvalProbability < 0.0 || approvalProbability > 1.0) {
            throw new IllegalArgumentException("approvalProbability must be within [0, 1], was " + approvalProbability);
        }
        this.approvalThreshold = approvalThreshold;
        this.approvalProbability = approvalProbability;
        this.random = random;
        this.latency = latency;
    }

    @Override
    public PaymentStatus decide(PaymentRequest request) throws InterruptedException {
        latency.await(request);

        if (request.getAmount().compareTo(approvalThreshold) < 0) {
            return PaymentStatus.APPROVED;
        }

        PaymentStatus status = random.nextDouble() < approvalProbability
                ? PaymentStatus.APPROVED
                : PaymentStatus.REJECTED;

        log.debug("High-value payment {} of {} decided: {}", request.getId(), request.getAmount(), status);
        return status;
    }
}
