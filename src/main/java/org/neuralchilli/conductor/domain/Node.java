package org.neuralchilli.conductor.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A unit of work with its own lifecycle status.
 * Status only moves forward in {@link NodeStatus} order, except into FAILED.
 * Side effects of transitions (status events, agent calls) live in NodeLifecycle.
 */
public final class Node {

    private final UUID id;
    private final String name;
    private final NodeKind kind;
    private final String description;
    private final String sessionId;
    private final UUID parentId;
    private final String agentName;
    private final ContextInfo contextInfo;
    private final List<Dependency> dependencies;
    private final List<Node> children;

    private volatile NodeStatus status = NodeStatus.CREATED;
    private final List<NodeStatus> statusHistory = new CopyOnWriteArrayList<>(List.of(NodeStatus.CREATED));
    private final Set<String> notifiedProperties = Collections.synchronizedSet(new HashSet<>());
    private final AtomicBoolean executionClaimed = new AtomicBoolean(false);
    private volatile String error;
    private volatile Instant updatedAt = Instant.now();

    private Node(Builder builder) {
        if (builder.name == null || builder.name.isBlank()) {
            throw new IllegalArgumentException("Node name cannot be null or empty");
        }
        if (builder.kind == null) {
            throw new IllegalArgumentException("Node kind cannot be null");
        }
        this.id = builder.id != null ? builder.id : UUID.randomUUID();
        this.name = builder.name;
        this.kind = builder.kind;
        this.description = builder.description != null ? builder.description : "";
        this.sessionId = builder.sessionId;
        this.parentId = builder.parentId;
        this.agentName = builder.agentName;
        this.contextInfo = builder.contextInfo != null ? builder.contextInfo : ContextInfo.empty();
        this.dependencies = List.copyOf(builder.dependencies);
        List<Node> kids = new ArrayList<>();
        for (Builder child : builder.children) {
            kids.add(child.parentId(this.id).sessionIdIfAbsent(builder.sessionId).build());
        }
        this.children = List.copyOf(kids);
    }

    public static Builder builder(String name, NodeKind kind) {
        return new Builder(name, kind);
    }

    public UUID id() {
        return id;
    }

    public String name() {
        return name;
    }

    public NodeKind kind() {
        return kind;
    }

    public String description() {
        return description;
    }

    public String sessionId() {
        return sessionId;
    }

    public UUID parentId() {
        return parentId;
    }

    public String agentName() {
        return agentName;
    }

    public ContextInfo contextInfo() {
        return contextInfo;
    }

    public List<Dependency> dependencies() {
        return dependencies;
    }

    public List<Node> children() {
        return children;
    }

    public NodeStatus status() {
        return status;
    }

    public List<NodeStatus> statusHistory() {
        return List.copyOf(statusHistory);
    }

    public String error() {
        return error;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /**
     * True iff every required dependency is met. Optional dependencies never block.
     */
    public boolean dependenciesMet() {
        for (Dependency dependency : dependencies) {
            if (dependency.required() && !dependency.isMet()) {
                return false;
            }
        }
        return true;
    }

    public List<Dependency> unmetDependencies() {
        List<Dependency> unmet = new ArrayList<>();
        for (Dependency dependency : dependencies) {
            if (!dependency.isMet()) {
                unmet.add(dependency);
            }
        }
        return unmet;
    }

    /**
     * Move to {@code next}.
     *
     * @return the previous status, or null if the node already was in {@code next}
     * @throws IllegalStateException if the move would regress or leave a terminal status
     */
    public synchronized NodeStatus transitionTo(NodeStatus next) {
        NodeStatus current = status;
        if (current == next) {
            return null;
        }
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Node '" + name + "' cannot move from " + current + " to " + next);
        }
        status = next;
        statusHistory.add(next);
        updatedAt = Instant.now();
        return current;
    }

    /**
     * Move to FAILED and remember why. No-op on a node that is already terminal.
     *
     * @return the previous status, or null if nothing changed
     */
    public synchronized NodeStatus fail(String reason) {
        if (status.isTerminal()) {
            return null;
        }
        this.error = reason;
        return transitionTo(NodeStatus.FAILED);
    }

    /**
     * Claim the right to execute. Only the first caller wins.
     */
    public boolean claimExecution() {
        return executionClaimed.compareAndSet(false, true);
    }

    /**
     * @return true if the property had not been notified yet in this cycle
     */
    public boolean markNotified(String property) {
        return notifiedProperties.add(property);
    }

    public void clearNotified() {
        notifiedProperties.clear();
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", id.toString());
        payload.put("name", name);
        payload.put("kind", kind.wireName());
        payload.put("description", description);
        payload.put("session_id", sessionId);
        payload.put("parent_id", parentId != null ? parentId.toString() : null);
        payload.put("status", status.wireName());
        payload.put("error", error);
        payload.put("context_info", contextInfo.toPayload());
        List<Map<String, Object>> deps = new ArrayList<>();
        for (Dependency dependency : dependencies) {
            Map<String, Object> dep = new LinkedHashMap<>();
            dep.put("context_key", dependency.contextKey());
            dep.put("property_name", dependency.propertyName());
            dep.put("property_path", dependency.propertyPath());
            dep.put("required", dependency.required());
            dep.put("is_met", dependency.isMet());
            deps.add(dep);
        }
        payload.put("dependencies", deps);
        List<String> childIds = new ArrayList<>();
        children.forEach(c -> childIds.add(c.id().toString()));
        payload.put("children", childIds);
        payload.put("updated_at", updatedAt.toString());
        return payload;
    }

    @Override
    public String toString() {
        return "Node[id=" + id + ", name=" + name + ", kind=" + kind + ", status=" + status + "]";
    }

    public static class Builder {
        private UUID id;
        private final String name;
        private final NodeKind kind;
        private String description;
        private String sessionId;
        private UUID parentId;
        private String agentName;
        private ContextInfo contextInfo;
        private final List<Dependency> dependencies = new ArrayList<>();
        private final List<Builder> children = new ArrayList<>();

        public Builder(String name, NodeKind kind) {
            this.name = name;
            this.kind = kind;
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        Builder sessionIdIfAbsent(String sessionId) {
            if (this.sessionId == null) {
                this.sessionId = sessionId;
            }
            return this;
        }

        Builder parentId(UUID parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder agent(String agentName) {
            this.agentName = agentName;
            return this;
        }

        public Builder contextInfo(ContextInfo contextInfo) {
            this.contextInfo = contextInfo;
            return this;
        }

        public Builder dependency(Dependency dependency) {
            this.dependencies.add(dependency);
            return this;
        }

        public Builder child(Builder child) {
            this.children.add(child);
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }
}
