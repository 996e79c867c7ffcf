package org.neuralchilli.conductor.messaging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Channel subscriptions shared by several waiters.
 * A channel is subscribed once, on its first waiter, and unsubscribed when its last
 * waiter is released.
 */
public class SubscriptionTracker {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionTracker.class);

    private final MessageBroker broker;
    private final MessageHandler handler;

    private final Map<String, Subscription> subscriptions = new HashMap<>();
    private final Map<String, Set<String>> waitersByChannel = new HashMap<>();
    private boolean closed;

    public SubscriptionTracker(MessageBroker broker, MessageHandler handler) {
        this.broker = broker;
        this.handler = handler;
    }

    /**
     * Register {@code waiter} as needing {@code channel}, subscribing if nobody did yet.
     *
     * @return true if this call created the broker subscription
     */
    public synchronized boolean acquire(String channel, String waiter) {
        if (closed) {
            throw new IllegalStateException("Subscription tracker is closed");
        }
        waitersByChannel.computeIfAbsent(channel, c -> new HashSet<>()).add(waiter);
        if (subscriptions.containsKey(channel)) {
            return false;
        }
        subscriptions.put(channel, broker.subscribe(channel, handler));
        return true;
    }

    /**
     * Drop every reference held by {@code waiter}; channels left without waiters are unsubscribed.
     */
    public synchronized void release(String waiter) {
        Iterator<Map.Entry<String, Set<String>>> it = waitersByChannel.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Set<String>> entry = it.next();
            if (entry.getValue().remove(waiter) && entry.getValue().isEmpty()) {
                it.remove();
                unsubscribe(entry.getKey());
            }
        }
    }

    public synchronized boolean isSubscribed(String channel) {
        return subscriptions.containsKey(channel);
    }

    public synchronized Set<String> channels() {
        return Set.copyOf(subscriptions.keySet());
    }

    public synchronized Set<String> waiters(String channel) {
        Set<String> waiters = waitersByChannel.get(channel);
        return waiters != null ? Set.copyOf(waiters) : Set.of();
    }

    /**
     * Unsubscribe everything. Further acquires fail.
     */
    public synchronized void close() {
        for (String channel : Set.copyOf(subscriptions.keySet())) {
            unsubscribe(channel);
        }
        waitersByChannel.clear();
        closed = true;
    }

    private void unsubscribe(String channel) {
        Subscription subscription = subscriptions.remove(channel);
        if (subscription == null) {
            return;
        }
        try {
            broker.unsubscribe(subscription);
        } catch (RuntimeException e) {
            log.warn("Failed to unsubscribe from {}", channel, e);
        }
    }
}
