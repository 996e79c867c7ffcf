package org.neuralchilli.conductor.messaging;

/**
 * Callback for messages delivered on a subscribed channel.
 */
@FunctionalInterface
public interface MessageHandler {

    void onMessage(String channel, String payload);
}
