package org.neuralchilli.conductor.messaging;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.topic.ITopic;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Broker on Hazelcast topics, one topic per channel.
 * Listener callbacks run on Hazelcast event threads, so handlers must not block.
 */
@ApplicationScoped
public class HazelcastMessageBroker implements MessageBroker {

    private static final Logger log = LoggerFactory.getLogger(HazelcastMessageBroker.class);

    private final HazelcastInstance hazelcast;

    @Inject
    public HazelcastMessageBroker(HazelcastInstance hazelcast) {
        this.hazelcast = hazelcast;
    }

    @Override
    public void publish(String channel, String payload) {
        topic(channel).publish(payload);
        log.trace("Published to {}: {}", channel, payload);
    }

    @Override
    public Subscription subscribe(String channel, MessageHandler handler) {
        UUID listenerId = topic(channel).addMessageListener(message -> {
            try {
                handler.onMessage(channel, message.getMessageObject());
            } catch (RuntimeException e) {
                log.error("Handler for channel {} failed", channel, e);
            }
        });
        log.debug("Subscribed to {} ({})", channel, listenerId);
        return new Subscription(channel, listenerId.toString());
    }

    @Override
    public void unsubscribe(Subscription subscription) {
        boolean removed = topic(subscription.channel())
                .removeMessageListener(UUID.fromString(subscription.id()));
        log.debug("Unsubscribed from {} ({}): {}", subscription.channel(), subscription.id(),
                removed ? "removed" : "not found");
    }

    private ITopic<String> topic(String channel) {
        return hazelcast.getTopic(channel);
    }
}
