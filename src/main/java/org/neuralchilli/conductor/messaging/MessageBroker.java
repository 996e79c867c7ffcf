package org.neuralchilli.conductor.messaging;

/**
 * Publish/subscribe transport. Delivery is at-least-once, so handlers must be idempotent.
 */
public interface MessageBroker {

    void publish(String channel, String payload);

    Subscription subscribe(String channel, MessageHandler handler);

    void unsubscribe(Subscription subscription);
}
