package org.neuralchilli.conductor.messaging;

/**
 * Handle returned by {@link MessageBroker#subscribe}, needed to unsubscribe.
 */
public record Subscription(String channel, String id) {

    public Subscription {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("Channel cannot be null or empty");
        }
        if (id == null) {
            throw new IllegalArgumentException("Subscription ID cannot be null");
        }
    }
}
