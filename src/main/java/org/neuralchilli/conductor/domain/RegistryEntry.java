package org.neuralchilli.conductor.domain;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Producer of a result key within a session.
 */
public record RegistryEntry(
        String taskGroupId,
        String taskGroupName,
        String taskName,
        List<String> dependencies,
        Instant timestamp
) {
    public RegistryEntry {
        if (taskGroupId == null || taskGroupId.isBlank()) {
            throw new IllegalArgumentException("Task group ID cannot be null or empty");
        }
        if (dependencies == null) {
            dependencies = List.of();
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_group_id", taskGroupId);
        payload.put("task_group_name", taskGroupName);
        payload.put("task_name", taskName);
        payload.put("dependencies", dependencies);
        payload.put("timestamp", timestamp.toString());
        return payload;
    }

    @SuppressWarnings("unchecked")
    public static RegistryEntry fromPayload(Map<String, Object> payload) {
        Object deps = payload.get("dependencies");
        Object ts = payload.get("timestamp");
        return new RegistryEntry(
                (String) payload.get("task_group_id"),
                (String) payload.get("task_group_name"),
                (String) payload.get("task_name"),
                deps instanceof List ? List.copyOf((List<String>) deps) : List.of(),
                ts != null ? Instant.parse(ts.toString()) : null
        );
    }
}
