package org.neuralchilli.conductor.core;

import io.quarkus.runtime.ShutdownEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.conductor.agent.AgentExecutor;
import org.neuralchilli.conductor.agent.AgentRegistry;
import org.neuralchilli.conductor.agent.AgentRequest;
import org.neuralchilli.conductor.config.ConductorConfig;
import org.neuralchilli.conductor.domain.ConfigurationException;
import org.neuralchilli.conductor.domain.Dependency;
import org.neuralchilli.conductor.domain.DependencyException;
import org.neuralchilli.conductor.domain.Node;
import org.neuralchilli.conductor.domain.NodeStatus;
import org.neuralchilli.conductor.domain.NodeStatusEvent;
import org.neuralchilli.conductor.domain.TaskExecutionException;
import org.neuralchilli.conductor.messaging.Channels;
import org.neuralchilli.conductor.messaging.MessageBroker;
import org.neuralchilli.conductor.messaging.MessageCodec;
import org.neuralchilli.conductor.monitoring.SchedulerMetrics;
import org.neuralchilli.conductor.store.StateStore;
import org.neuralchilli.conductor.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Drives nodes through their status machine.
 * <p>
 * Every transition is published as a {@link NodeStatusEvent} on {@code node_status_updates}
 * and on the node's own status channel. Publishing never fails a transition.
 * <p>
 * Nodes started with {@link #run(Node)} that are still waiting get their dependencies
 * re-resolved every fallback poll interval, so producers may register after the node started.
 * A session's resolver is closed once none of its nodes is waiting or running.
 */
@ApplicationScoped
public class NodeLifecycle {

    private static final Logger log = LoggerFactory.getLogger(NodeLifecycle.class);

    private final MessageBroker broker;
    private final StateStore store;
    private final MessageCodec codec;
    private final DependencyRegistry registry;
    private final AgentRegistry agents;
    private final WorkerPool workerPool;
    private final SchedulerMetrics metrics;
    private final ConductorConfig config;

    private record PendingRun(Node node, CompletableFuture<Node> future) {
    }

    // Guarded by itself; resolvers are created, used for resolving and closed under this lock
    private final Map<String, DependencyResolver> resolvers = new ConcurrentHashMap<>();
    private final Map<UUID, PendingRun> pendingRuns = new ConcurrentHashMap<>();

    private final Object recheckLock = new Object();
    private ScheduledFuture<?> recheck;

    @Inject
    public NodeLifecycle(
            MessageBroker broker,
            StateStore store,
            MessageCodec codec,
            DependencyRegistry registry,
            AgentRegistry agents,
            WorkerPool workerPool,
            SchedulerMetrics metrics,
            ConductorConfig config
    ) {
        this.broker = broker;
        this.store = store;
        this.codec = codec;
        this.registry = registry;
        this.agents = agents;
        this.workerPool = workerPool;
        this.metrics = metrics;
        this.config = config;
    }

    void onStop(@Observes ShutdownEvent event) {
        synchronized (recheckLock) {
            if (recheck != null) {
                recheck.cancel(false);
                recheck = null;
            }
        }
        synchronized (resolvers) {
            resolvers.values().forEach(DependencyResolver::close);
            resolvers.clear();
        }
    }

    public void initialize(Node node) {
        initialize(node, n -> {
        });
    }

    /**
     * CREATED to INITIALIZED, running {@code setup} while INITIALIZING.
     *
     * @throws TaskExecutionException if setup fails; the node is then FAILED
     */
    public void initialize(Node node, Consumer<Node> setup) {
        advance(node, NodeStatus.PRE_INITIALIZING);
        advance(node, NodeStatus.INITIALIZING);
        try {
            setup.accept(node);
        } catch (RuntimeException e) {
            failNode(node, e);
            throw new TaskExecutionException("Setup of node '" + node.name() + "' failed: " + e.getMessage(),
                    node.name(), e);
        }
        advance(node, NodeStatus.INITIALIZED);
    }

    /**
     * Start resolving the node's dependencies.
     *
     * @return true if the node reached DEPENDENCIES_RESOLVED right away
     */
    public boolean resolveDependencies(Node node) {
        advance(node, NodeStatus.RESOLVING_DEPENDENCIES);
        if (node.dependencies().isEmpty()) {
            persistContext(node);
            advance(node, NodeStatus.DEPENDENCIES_RESOLVED);
            return true;
        }
        resolveWithSessionResolver(node);
        return checkDependencies(node);
    }

    public boolean dependenciesMet(Node node) {
        return node.dependenciesMet();
    }

    /**
     * Advance to DEPENDENCIES_RESOLVED if every required dependency is met.
     */
    public boolean checkDependencies(Node node) {
        if (!node.dependenciesMet()) {
            return false;
        }
        advanceIfBefore(node, NodeStatus.DEPENDENCIES_RESOLVED);
        return true;
    }

    /**
     * Merge a delivered payload into the node's output. Status is left alone.
     */
    public void onDependencyUpdate(Node node, Map<String, Object> payload) {
        node.contextInfo().mergeOutput(payload);
        log.debug("Node {} received update for {}", node.name(), payload.keySet());
    }

    public Node assignAndExecute(Node node) {
        return assignAndExecute(node, null);
    }

    /**
     * Execute the node with {@code agent}, or with its registered agent when null,
     * then run its children in order.
     *
     * @throws DependencyException    if required dependencies are not met
     * @throws TaskExecutionException on any failure; the node is then FAILED
     */
    public Node assignAndExecute(Node node, AgentExecutor agent) {
        if (!node.dependenciesMet()) {
            List<String> missing = node.unmetDependencies().stream()
                    .filter(Dependency::required)
                    .map(Dependency::contextKey)
                    .collect(Collectors.toList());
            throw new DependencyException("Node '" + node.name() + "' has unmet dependencies",
                    node.name(), missing);
        }

        SchedulerMetrics.Timer timer = metrics.startTimer("node.execute");
        try {
            advance(node, NodeStatus.READY);
            advance(node, NodeStatus.ASSIGNING);
            AgentExecutor executor = agent != null ? agent : agentFor(node);
            advance(node, NodeStatus.ASSIGNED);
            advance(node, NodeStatus.PRE_EXECUTE);
            advance(node, NodeStatus.EXECUTING);

            Map<String, Object> context = node.contextInfo().context();
            ContextMerger.deepMerge(context, node.contextInfo().output());
            AgentRequest request = new AgentRequest(node.name(), executor.name(), node.description(),
                    node.contextInfo().inputDescription(), List.of(), List.of(), List.of(), node.sessionId(), 1);

            Map<String, Object> result = executor.execute(request, context);
            if (result != null) {
                node.contextInfo().mergeOutput(result);
            }

            for (Node child : node.children()) {
                runChild(node, child, agent);
            }

            advance(node, NodeStatus.MONITORING);
            publishUpdates(node);
            advance(node, NodeStatus.COMPLETED);
            log.info("Node {} ({}) completed", node.name(), node.id());
            return node;
        } catch (Exception e) {
            failNode(node, e);
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (e instanceof TaskExecutionException) {
                throw (TaskExecutionException) e;
            }
            throw new TaskExecutionException("Node '" + node.name() + "' failed: " + e.getMessage(),
                    node.name(), e);
        } finally {
            timer.stop();
            releaseNode(node);
        }
    }

    /**
     * Initialize, resolve and execute a node. Execution starts as soon as its
     * dependencies are met, at most once.
     */
    public CompletableFuture<Node> run(Node node) {
        CompletableFuture<Node> future = new CompletableFuture<>();
        pendingRuns.put(node.id(), new PendingRun(node, future));
        try {
            initialize(node);
            if (resolveDependencies(node)) {
                launch(node);
            } else {
                log.debug("Node {} waiting for {}", node.name(), node.unmetDependencies());
                scheduleRecheck();
            }
        } catch (RuntimeException e) {
            pendingRuns.remove(node.id());
            releaseNode(node);
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Close the session's resolver and fail its waiting runs with a {@link DependencyException}.
     *
     * @return number of waiting runs that were abandoned
     */
    public int releaseSession(String sessionId) {
        int abandoned = 0;
        for (PendingRun pending : pendingRuns.values()) {
            Node node = pending.node();
            if (sessionId.equals(node.sessionId()) && pendingRuns.remove(node.id(), pending)) {
                List<String> missing = node.unmetDependencies().stream()
                        .filter(Dependency::required)
                        .map(Dependency::contextKey)
                        .collect(Collectors.toList());
                pending.future().completeExceptionally(new DependencyException(
                        "Session " + sessionId + " was released while node '" + node.name() + "' was waiting",
                        node.name(), missing));
                abandoned++;
            }
        }
        DependencyResolver resolver;
        synchronized (resolvers) {
            resolver = resolvers.remove(sessionId);
            if (resolver != null) {
                resolver.close();
            }
        }
        if (resolver != null || abandoned > 0) {
            log.info("Released session {}: {} waiting nodes abandoned", sessionId, abandoned);
        }
        return abandoned;
    }

    /**
     * Result channels currently subscribed on behalf of the session's nodes.
     */
    public Set<String> subscribedChannels(String sessionId) {
        DependencyResolver resolver = resolvers.get(sessionId);
        return resolver != null ? resolver.subscribedChannels() : Set.of();
    }

    public int pendingRunCount() {
        return pendingRuns.size();
    }

    /**
     * Re-resolve every waiting node. Producers registered since the last pass get subscribed
     * and values already in the store are picked up.
     */
    void recheckPendingRuns() {
        for (PendingRun pending : pendingRuns.values()) {
            Node node = pending.node();
            if (pending.future().isDone() || node.status().isTerminal()) {
                pendingRuns.remove(node.id(), pending);
                continue;
            }
            try {
                resolveWithSessionResolver(node);
                if (checkDependencies(node)) {
                    launch(node);
                }
            } catch (RuntimeException e) {
                log.warn("Re-check of node {} failed: {}", node.name(), e.getMessage());
            }
        }
        synchronized (recheckLock) {
            if (pendingRuns.isEmpty() && recheck != null) {
                recheck.cancel(false);
                recheck = null;
            }
        }
    }

    private void scheduleRecheck() {
        synchronized (recheckLock) {
            if (recheck == null || recheck.isDone()) {
                recheck = workerPool.scheduleAtFixedRate(this::recheckPendingRuns, config.fallbackPollInterval());
            }
        }
    }

    /**
     * Publish {@code {property: value}} on the node's output channel, once per property per cycle.
     *
     * @return false if the property was already published in this cycle
     */
    public boolean publishOutput(Node node, String property, Object value) {
        if (!node.markNotified(property)) {
            return false;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(property, value);
        publish(Channels.nodeOutput(node.id().toString()), ContextMerger.serialize(payload));
        return true;
    }

    /**
     * Publish the whole node and start a new notification cycle.
     */
    public void publishUpdates(Node node) {
        publish(Channels.node(node.id().toString()), node.toPayload());
        node.clearNotified();
    }

    private void runChild(Node parent, Node child, AgentExecutor agent) {
        child.contextInfo().mergeContext(parent.contextInfo().output());
        initialize(child);
        if (!resolveDependencies(child)) {
            throw new DependencyException("Child '" + child.name() + "' of '" + parent.name()
                    + "' has unmet dependencies", child.name(),
                    child.unmetDependencies().stream().map(Dependency::contextKey).collect(Collectors.toList()));
        }
        // Children without an agent of their own reuse the parent's
        AgentExecutor childAgent = child.agentName() != null ? null : agent != null ? agent : agentFor(parent);
        assignAndExecute(child, childAgent);
        parent.contextInfo().mergeOutput(child.contextInfo().output());
    }

    private void onNodeDependencyMet(Node node, Dependency dependency) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(dependency.propertyName(), dependency.output());
        onDependencyUpdate(node, payload);
        if (checkDependencies(node) && pendingRuns.containsKey(node.id())) {
            launch(node);
        }
    }

    private void launch(Node node) {
        if (!node.claimExecution()) {
            return;
        }
        PendingRun pending = pendingRuns.remove(node.id());
        CompletableFuture<Node> future = pending != null ? pending.future() : null;
        workerPool.submitTask(() -> {
            try {
                assignAndExecute(node);
                if (future != null) {
                    future.complete(node);
                }
            } catch (RuntimeException e) {
                log.error("Node {} failed", node.name(), e);
                if (future != null) {
                    future.completeExceptionally(e);
                }
            }
        });
    }

    private AgentExecutor agentFor(Node node) {
        if (node.agentName() == null) {
            throw new ConfigurationException("Node '" + node.name() + "' has no agent",
                    node.name(), "agent", List.of("Set an agent name on the node"));
        }
        return agents.agent(node.agentName());
    }

    private void resolveWithSessionResolver(Node node) {
        if (node.sessionId() == null) {
            throw new DependencyException("Node '" + node.name() + "' has dependencies but no session",
                    node.name(), node.unmetDependencies().stream().map(Dependency::contextKey).collect(Collectors.toList()));
        }
        synchronized (resolvers) {
            resolvers.computeIfAbsent(node.sessionId(), sessionId -> new DependencyResolver(
                    sessionId, config.channelScope(), registry, broker, codec, metrics,
                    null, this::onNodeDependencyMet)).resolve(node);
        }
    }

    private void releaseNode(Node node) {
        String sessionId = node.sessionId();
        if (sessionId == null) {
            return;
        }
        synchronized (resolvers) {
            DependencyResolver resolver = resolvers.get(sessionId);
            if (resolver == null) {
                return;
            }
            resolver.release(node.id().toString());
            if (resolver.isIdle() && !hasPendingRuns(sessionId)) {
                resolvers.remove(sessionId);
                resolver.close();
                log.debug("Closed idle resolver of session {}", sessionId);
            }
        }
    }

    private boolean hasPendingRuns(String sessionId) {
        return pendingRuns.values().stream().anyMatch(p -> sessionId.equals(p.node().sessionId()));
    }

    private void persistContext(Node node) {
        try {
            store.set(Channels.nodeContext(node.id().toString()),
                    codec.encode(ContextMerger.serialize(node.contextInfo().context())));
        } catch (RuntimeException e) {
            log.warn("Could not persist context of node {}: {}", node.name(), e.getMessage());
        }
    }

    private void advance(Node node, NodeStatus next) {
        NodeStatus previous = node.transitionTo(next);
        if (previous != null) {
            publishStatus(node, previous);
        }
    }

    private void advanceIfBefore(Node node, NodeStatus target) {
        NodeStatus previous = null;
        synchronized (node) {
            if (!node.status().isTerminal() && node.status().ordinal() < target.ordinal()) {
                previous = node.transitionTo(target);
            }
        }
        if (previous != null) {
            publishStatus(node, previous);
        }
    }

    private void failNode(Node node, Exception error) {
        String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        NodeStatus previous = node.fail(reason);
        if (previous != null) {
            log.error("Node {} ({}) failed in {}: {}", node.name(), node.id(), previous, reason);
            publishStatus(node, previous);
        }
    }

    private void publishStatus(Node node, NodeStatus previous) {
        Map<String, Object> payload = NodeStatusEvent.of(node, previous).toPayload();
        publish(Channels.NODE_STATUS_UPDATES, payload);
        publish(Channels.nodeStatus(node.id().toString()), payload);
    }

    private void publish(String channel, Map<String, Object> payload) {
        try {
            broker.publish(channel, codec.encode(payload));
        } catch (RuntimeException e) {
            log.warn("Could not publish to {}: {}", channel, e.getMessage());
        }
    }
}
