package org.neuralchilli.conductor.domain;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure record for one task of a group.
 */
public record TaskFailure(
        String taskName,
        String error,
        ErrorType errorType,
        Instant timestamp
) {
    public TaskFailure {
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("Task name cannot be null or empty");
        }
        if (errorType == null) {
            errorType = ErrorType.EXECUTION_ERROR;
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static TaskFailure of(String taskName, Throwable error) {
        ErrorType type = error instanceof OrchestrationException
                ? ((OrchestrationException) error).errorType()
                : ErrorType.EXECUTION_ERROR;
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new TaskFailure(taskName, message, type, Instant.now());
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_name", taskName);
        payload.put("error", error);
        payload.put("error_type", errorType.wireName());
        payload.put("timestamp", timestamp.toString());
        return payload;
    }
}
