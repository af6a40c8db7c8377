package com.flagship.payment_service.messaging;

import java.util.function.Consumer;

/**
 * Boundary to the message bus for inbound events.
 *
 * Handlers receive the raw JSON payload. A handler that returns normally has
 * consumed the message; a handler that throws leaves redelivery to the bus.
 */
public interface EventSubscriber {

    /**
     * Starts delivering messages from a topic to a handler.
     *
     * @param topic Topic to subscribe to
     * @param handler Receives each message payload
     * @return Handle that stops the delivery when closed
     */
    Subscription subscribe(String topic, Consumer<String> handler);

    /**
     * An active subscription.
     */
    interface Subscription extends AutoCloseable {

        String topic();

        @Override
        void close();
    }
}
