package org.neuralchilli.conductor.core;

import org.neuralchilli.conductor.domain.Dependency;
import org.neuralchilli.conductor.domain.DependencyException;
import org.neuralchilli.conductor.domain.Node;
import org.neuralchilli.conductor.domain.RegistryEntry;
import org.neuralchilli.conductor.messaging.Channels;
import org.neuralchilli.conductor.messaging.MessageBroker;
import org.neuralchilli.conductor.messaging.MessageCodec;
import org.neuralchilli.conductor.messaging.SubscriptionTracker;
import org.neuralchilli.conductor.monitoring.SchedulerMetrics;
import org.neuralchilli.conductor.util.PathValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Turns "I need X" into "I will be notified when X exists".
 * <p>
 * One resolver serves one task group (or one session's nodes). For every unmet
 * dependency it looks the producer up in the {@link DependencyRegistry}, subscribes to
 * the producer's result channel and marks the dependency met on the first delivery.
 * Redeliveries are ignored. Channels are shared between waiters and reference-counted.
 */
public class DependencyResolver implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /**
     * Called once per result key, on its first delivery.
     */
    @FunctionalInterface
    public interface Listener {
        void onDependencySatisfied(String resultKey, Object value);
    }

    /**
     * Called once per node dependency, when it becomes met.
     */
    @FunctionalInterface
    public interface NodeListener {
        void onNodeDependencyMet(Node node, Dependency dependency);
    }

    private record Delivered(Object value) {
    }

    private final String sessionId;
    private final String scope;
    private final DependencyRegistry registry;
    private final MessageCodec codec;
    private final SchedulerMetrics metrics;
    private final Listener listener;
    private final NodeListener nodeListener;
    private final SubscriptionTracker subscriptions;

    private final ConcurrentMap<String, Delivered> delivered = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Node> watchedNodes = new ConcurrentHashMap<>();

    public DependencyResolver(
            String sessionId,
            String scope,
            DependencyRegistry registry,
            MessageBroker broker,
            MessageCodec codec,
            SchedulerMetrics metrics,
            Listener listener,
            NodeListener nodeListener
    ) {
        this.sessionId = sessionId;
        this.scope = scope;
        this.registry = registry;
        this.codec = codec;
        this.metrics = metrics;
        this.listener = listener;
        this.nodeListener = nodeListener;
        this.subscriptions = new SubscriptionTracker(broker, this::onMessage);
    }

    /**
     * Check whether every required dependency of a task has been delivered. Unmet
     * required and optional dependencies get subscriptions held by {@code waiter}.
     */
    public boolean areDependenciesReady(String waiter, Collection<String> required, Collection<String> optional) {
        boolean ready = true;
        for (String dependency : required) {
            if (!isSatisfied(dependency)) {
                watch(waiter, dependency);
                if (!isSatisfied(dependency)) {
                    ready = false;
                }
            }
        }
        for (String dependency : optional) {
            if (!isSatisfied(dependency)) {
                watch(waiter, dependency);
            }
        }
        return ready;
    }

    /**
     * Resolve a node's unmet dependencies, from values already delivered or by subscribing.
     *
     * @return true if all required dependencies of the node are met
     */
    public boolean resolve(Node node) {
        String waiter = node.id().toString();
        watchedNodes.put(waiter, node);
        for (Dependency dependency : node.unmetDependencies()) {
            Delivered known = delivered.get(dependency.contextKey());
            if (known != null) {
                applyToNode(node, dependency, known.value());
            } else {
                watch(waiter, dependency.contextKey());
            }
        }
        return node.dependenciesMet();
    }

    public boolean isSatisfied(String resultKey) {
        return delivered.containsKey(resultKey);
    }

    public Optional<Object> deliveredValue(String resultKey) {
        Delivered d = delivered.get(resultKey);
        return d != null ? Optional.ofNullable(d.value()) : Optional.empty();
    }

    /**
     * Mark keys whose values are already present in the context as satisfied,
     * without subscribing and without notifying the listener.
     *
     * @return number of keys newly marked
     */
    public int markAvailable(Map<String, ?> values) {
        int marked = 0;
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            if (delivered.putIfAbsent(entry.getKey(), new Delivered(entry.getValue())) == null) {
                marked++;
            }
        }
        if (marked > 0) {
            log.debug("Marked {} context keys as available in session {}", marked, sessionId);
        }
        return marked;
    }

    /**
     * Drop the subscriptions held by {@code waiter}. Channels still needed by other
     * waiters stay subscribed.
     */
    public void release(String waiter) {
        watchedNodes.remove(waiter);
        subscriptions.release(waiter);
    }

    /**
     * True when no node is watched and no channel is held.
     */
    public boolean isIdle() {
        return watchedNodes.isEmpty() && subscriptions.channels().isEmpty();
    }

    public Set<String> subscribedChannels() {
        return subscriptions.channels();
    }

    public Set<String> waitersOf(String channel) {
        return subscriptions.waiters(channel);
    }

    @Override
    public void close() {
        subscriptions.close();
        watchedNodes.clear();
    }

    /**
     * Subscribe {@code waiter} to the producer channel of {@code resultKey}, then check the
     * store for a value published before the subscription existed.
     * Lookup failures leave the dependency pending.
     */
    private void watch(String waiter, String resultKey) {
        Optional<RegistryEntry> producer;
        try {
            producer = registry.lookup(sessionId, resultKey);
        } catch (DependencyException e) {
            log.warn("Dependency '{}' for {} not resolvable yet: {}", resultKey, waiter, e.getMessage());
            return;
        }
        if (producer.isEmpty()) {
            log.trace("No producer registered for '{}' yet, {} keeps waiting", resultKey, waiter);
            return;
        }

        String channel = Channels.resultChannel(scope, producer.get().taskGroupId(), resultKey);
        if (subscriptions.acquire(channel, waiter)) {
            log.debug("Subscribed to {} for {}", channel, waiter);
        }

        try {
            registry.findValue(sessionId, resultKey)
                    .ifPresent(value -> deliver(resultKey, value, "store"));
        } catch (DependencyException e) {
            log.warn("Could not read stored value of '{}': {}", resultKey, e.getMessage());
        }
    }

    private void onMessage(String channel, String payload) {
        String resultKey = Channels.resultKeyOf(channel);
        Object value = extractValue(resultKey, codec.decode(payload));
        deliver(resultKey, value, channel);
    }

    /**
     * Structured updates carry {@code value}; other maps may be keyed by the result key;
     * anything else is the value itself.
     */
    static Object extractValue(String resultKey, Object message) {
        if (message instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) message;
            if (map.containsKey("result_key") && map.containsKey("value")) {
                return map.get("value");
            }
            if (map.containsKey(resultKey)) {
                return map.get(resultKey);
            }
        }
        return message;
    }

    private void deliver(String resultKey, Object value, String source) {
        if (delivered.putIfAbsent(resultKey, new Delivered(value)) == null) {
            log.debug("Dependency '{}' satisfied via {}", resultKey, source);
            metrics.recordDependencySatisfied();
            if (listener != null) {
                listener.onDependencySatisfied(resultKey, value);
            }
        } else {
            log.debug("Ignoring duplicate delivery of '{}' via {}", resultKey, source);
            metrics.recordDuplicateDelivery();
        }

        for (Node node : watchedNodes.values()) {
            for (Dependency dependency : node.dependencies()) {
                if (dependency.contextKey().equals(resultKey)) {
                    applyToNode(node, dependency, value);
                }
            }
        }
    }

    private void applyToNode(Node node, Dependency dependency, Object value) {
        Object resolved = PathValues.resolve(value, dependency.propertyPath());
        if (dependency.markMet(resolved) && nodeListener != null) {
            nodeListener.onNodeDependencyMet(node, dependency);
        }
    }
}
