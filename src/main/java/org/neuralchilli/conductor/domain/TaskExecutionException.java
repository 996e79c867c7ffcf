package org.neuralchilli.conductor.domain;

import java.util.List;

/**
 * A single task (or node) failed to execute. Recorded against the task; the group carries on.
 */
public class TaskExecutionException extends OrchestrationException {

    public TaskExecutionException(String message, String taskName) {
        super(ErrorType.EXECUTION_ERROR, message, taskName, List.of(), null);
    }

    public TaskExecutionException(String message, String taskName, Throwable cause) {
        super(ErrorType.EXECUTION_ERROR, message, taskName, List.of(), cause);
    }

    public TaskExecutionException(String message, String taskName, List<String> suggestions) {
        super(ErrorType.EXECUTION_ERROR, message, taskName, suggestions, null);
    }
}
