package org.neuralchilli.conductor.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Immutable description of a task group, as received in an initialize instruction
 * or loaded from YAML.
 */
public record TaskGroupDefinition(
        String id,
        String key,
        String name,
        String sessionId,
        List<TaskInfo> tasks,
        ContextInfo contextInfo
) {
    public TaskGroupDefinition {
        if (id == null || id.isBlank()) {
            id = UUID.randomUUID().toString();
        }
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Task group name cannot be null or empty",
                    null, "name", List.of("Name every task group"));
        }
        if (sessionId == null || sessionId.isBlank()) {
            throw new ConfigurationException("Task group '" + name + "' has no session id",
                    null, "session_id", List.of("Set session_id so result keys can be shared"));
        }
        if (tasks == null || tasks.isEmpty()) {
            throw new ConfigurationException("Task group '" + name + "' must have at least one task",
                    null, "tasks", List.of("Add at least one task to the group"));
        }
        tasks = List.copyOf(tasks);
        if (contextInfo == null) {
            contextInfo = ContextInfo.empty();
        }
    }

    public List<String> taskNames() {
        List<String> names = new ArrayList<>(tasks.size());
        tasks.forEach(t -> names.add(t.name()));
        return names;
    }

    /**
     * Group key, defaulting to {@code scope:id} when none was given.
     */
    public String groupKey(String scope) {
        return key != null && !key.isBlank() ? key : scope + ":" + id;
    }
}
