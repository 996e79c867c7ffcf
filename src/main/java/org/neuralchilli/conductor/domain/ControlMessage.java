package org.neuralchilli.conductor.domain;

import java.util.Map;

/**
 * Inbound instruction for the scheduler: {@code {key, action, object, context}}.
 */
public record ControlMessage(
        String key,
        String action,
        Map<String, Object> object,
        Map<String, Object> context
) {
    public static final String ACTION_INITIALIZE = "initialize";

    public ControlMessage {
        if (object == null) {
            object = Map.of();
        }
        if (context == null) {
            context = Map.of();
        }
    }

    public boolean isInitialize() {
        return ACTION_INITIALIZE.equals(action);
    }

    /**
     * Session-wide launch carrying several groups under {@code task_groups}.
     */
    public boolean isSessionLaunch() {
        return object.get("task_groups") instanceof Iterable;
    }
}
