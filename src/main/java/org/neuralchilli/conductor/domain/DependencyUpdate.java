package org.neuralchilli.conductor.domain;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notification that a result key now has a value.
 */
public record DependencyUpdate(
        String taskName,
        String resultKey,
        Object value,
        Instant timestamp
) {
    public DependencyUpdate {
        if (resultKey == null || resultKey.isBlank()) {
            throw new IllegalArgumentException("Result key cannot be null or empty");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static DependencyUpdate of(String taskName, String resultKey, Object value) {
        return new DependencyUpdate(taskName, resultKey, value, Instant.now());
    }

    public boolean isArray() {
        return value instanceof Collection || (value != null && value.getClass().isArray());
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_name", taskName);
        payload.put("result_key", resultKey);
        payload.put("value", value);
        payload.put("is_array", isArray());
        payload.put("timestamp", timestamp.toString());
        return payload;
    }
}
