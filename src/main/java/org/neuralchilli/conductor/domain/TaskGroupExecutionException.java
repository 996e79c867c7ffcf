package org.neuralchilli.conductor.domain;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Terminal group-level failure: the group timed out or its own bookkeeping broke.
 * Always carries the partial state so callers never see a bare failure.
 */
public class TaskGroupExecutionException extends OrchestrationException {

    public static final String DEFAULT_MESSAGE = "Some tasks failed during execution";

    private final String groupId;
    private final boolean timedOut;
    private final List<TaskFailure> failedTasks;
    private final Set<String> completedTasks;
    private final Map<String, Object> partialContext;

    public TaskGroupExecutionException(
            String message,
            String groupId,
            boolean timedOut,
            List<TaskFailure> failedTasks,
            Set<String> completedTasks,
            Map<String, Object> partialContext,
            Throwable cause
    ) {
        super(ErrorType.TASK_GROUP_EXECUTION_ERROR,
                message != null ? message : DEFAULT_MESSAGE,
                null, List.of(), cause);
        this.groupId = groupId;
        this.timedOut = timedOut;
        this.failedTasks = failedTasks != null ? List.copyOf(failedTasks) : List.of();
        this.completedTasks = completedTasks != null ? Set.copyOf(completedTasks) : Set.of();
        this.partialContext = partialContext != null ? partialContext : Map.of();
    }

    public String groupId() {
        return groupId;
    }

    public boolean timedOut() {
        return timedOut;
    }

    public List<TaskFailure> failedTasks() {
        return failedTasks;
    }

    public Set<String> completedTasks() {
        return completedTasks;
    }

    public Map<String, Object> partialContext() {
        return partialContext;
    }

    @Override
    protected void appendDetails(StringBuilder sb) {
        sb.append("\nGroup: ").append(groupId);
        if (timedOut) {
            sb.append(" (timed out)");
        }
        for (TaskFailure failure : failedTasks) {
            sb.append("\n  ").append(failure.taskName()).append(": ").append(failure.error());
        }
    }
}
