package com.flagship.payment_service.messaging;

/**
 * Boundary to the message bus for outbound events.
 *
 * Delivery is at-least-once from the caller's point of view: a call that
 * returns normally has been acknowledged by the broker, a call that throws
 * may or may not have been delivered.
 */
public interface EventPublisher {

    /**
     * Publishes an event, serialized as JSON.
     *
     * @param topic Destination topic
     * @param key Partitioning key (may be null)
     * @param event Event payload
     * @throws EventPublishException if the broker did not acknowledge the event
     */
    void publish(String topic, String key, Object event);

    default void publish(String topic, Object event) {
        publish(topic, null, event);
    }
}
