package org.neuralchilli.conductor.domain;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Published on every node status transition.
 */
public record NodeStatusEvent(
        UUID nodeId,
        String name,
        NodeKind kind,
        String sessionId,
        NodeStatus previousStatus,
        NodeStatus status,
        String error,
        Instant timestamp
) {
    public NodeStatusEvent {
        if (nodeId == null) {
            throw new IllegalArgumentException("Node ID cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static NodeStatusEvent of(Node node, NodeStatus previousStatus) {
        return new NodeStatusEvent(node.id(), node.name(), node.kind(), node.sessionId(),
                previousStatus, node.status(), node.error(), Instant.now());
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("node_id", nodeId.toString());
        payload.put("name", name);
        payload.put("kind", kind.wireName());
        payload.put("session_id", sessionId);
        payload.put("previous_status", previousStatus != null ? previousStatus.wireName() : null);
        payload.put("status", status.wireName());
        if (error != null) {
            payload.put("error", error);
        }
        payload.put("timestamp", timestamp.toString());
        return payload;
    }
}
