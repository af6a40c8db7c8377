package com.flagship.payment_service.payment.decision;

import com.flagship.payment_service.payment.PaymentRequest;
import com.flagship.payment_service.payment.PaymentStatus;

/**
 * Abstraction over the external payment network.
 *
 * <p>This service ships a simulated implementation ({@link SimulatedPaymentDecisionGateway}).
 * A real integration replaces it without touching the processing pipeline.</p>
 */
public interface PaymentDecisionGateway {

    /**
     * Asks the payment network to decide a validated request. May block for
     * as long as the network takes; the caller enforces the timeout by
     * interrupting the calling thread.
     *
     * @param request A request that passed validation
     * @return The network's decision
     * @throws InterruptedException if the call was cancelled while waiting
     */
    PaymentStatus decide(PaymentRequest request) throws InterruptedException;
}
