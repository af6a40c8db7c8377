package com.flagship.payment_service.messaging;

/**
 * Topic names shared with the other services of the mesh.
 */
public final class Topics {

    public static final String PAYMENT_REQUEST = "payment-request";
    public static final String PAYMENT_COMPLETED = "payment-completed";
    public static final String PAYMENT_FAILED = "payment-failed";
    public static final String ORDER_CREATED = "order-created";

    private Topics() {
        // Constants holder
    }
}
