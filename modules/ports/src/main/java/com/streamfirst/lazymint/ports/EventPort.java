package com.streamfirst.lazymint.ports;

import java.util.function.Consumer;

/**
 * Port for publishing audit events.
 * Subscribers observe events; they never influence the operation that emitted them.
 */
public interface EventPort {

    /**
     * Publishes an event synchronously to a topic.
     *
     * @param topic the topic to publish to
     * @param event the event object to publish
     */
    void publish(String topic, Object event);

    /**
     * Subscribes to a topic with a handler for all event types.
     *
     * @param topic the topic to subscribe to
     * @param handler the handler to process received events
     * @return subscription ID for managing this specific subscription
     */
    String subscribe(String topic, Consumer<Object> handler);

    /**
     * Subscribes to a topic with type-safe event handling.
     * Only events of the specified type (or its subtypes) will be passed to the handler.
     *
     * @param topic the topic to subscribe to
     * @param eventType the expected event type
     * @param handler the handler to process received events
     * @return subscription ID for managing this specific subscription
     */
    <T> String subscribe(String topic, Class<T> eventType, Consumer<? super T> handler);

    /**
     * Unsubscribes a specific subscription by its ID.
     *
     * @param subscriptionId the subscription ID to remove
     * @return true if subscription was found and removed, false otherwise
     */
    boolean unsubscribe(String subscriptionId);
}
