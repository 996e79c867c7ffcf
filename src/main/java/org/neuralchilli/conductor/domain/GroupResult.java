package org.neuralchilli.conductor.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of a task group run, published on its completion or partial-results channel.
 */
public record GroupResult(
        String groupId,
        String groupName,
        String sessionId,
        GroupStatus status,
        Set<String> completedTasks,
        List<TaskFailure> failedTasks,
        Map<String, Object> context,
        Instant timestamp
) {
    public GroupResult {
        if (groupId == null) {
            throw new IllegalArgumentException("Group ID cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        completedTasks = completedTasks != null ? Set.copyOf(completedTasks) : Set.of();
        failedTasks = failedTasks != null ? List.copyOf(failedTasks) : List.of();
        if (context == null) {
            context = Map.of();
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public boolean isCompleted() {
        return status == GroupStatus.COMPLETED;
    }

    /**
     * Wire form. Timeouts are reported with status "timeout".
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", status == GroupStatus.TIMED_OUT ? "timeout" : status.name().toLowerCase(Locale.ROOT));
        payload.put("group_id", groupId);
        payload.put("group_name", groupName);
        payload.put("session_id", sessionId);
        payload.put("completed_tasks", new ArrayList<>(completedTasks));
        List<Map<String, Object>> failures = new ArrayList<>();
        failedTasks.forEach(f -> failures.add(f.toPayload()));
        payload.put("failed_tasks", failures);
        payload.put("context", context);
        payload.put("timestamp", timestamp.toString());
        return payload;
    }
}
