package org.neuralchilli.conductor.domain;

import java.util.List;

/**
 * Base type for scheduler errors.
 * Carries enough detail to render an actionable report for whoever configured the task.
 */
public abstract class OrchestrationException extends RuntimeException {

    private final ErrorType errorType;
    private final String taskName;
    private final List<String> suggestions;

    protected OrchestrationException(
            ErrorType errorType,
            String message,
            String taskName,
            List<String> suggestions,
            Throwable cause
    ) {
        super(message, cause);
        this.errorType = errorType;
        this.taskName = taskName;
        this.suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    public ErrorType errorType() {
        return errorType;
    }

    public String taskName() {
        return taskName;
    }

    public List<String> suggestions() {
        return suggestions;
    }

    /**
     * Multi-line report: title, task, type-specific details and suggestions.
     */
    public String toReport() {
        StringBuilder sb = new StringBuilder();
        sb.append(errorType.title()).append(": ").append(getMessage());
        if (taskName != null) {
            sb.append("\nTask: ").append(taskName);
        }
        appendDetails(sb);
        if (!suggestions.isEmpty()) {
            sb.append("\nSuggestions to fix:");
            suggestions.forEach(s -> sb.append("\n- ").append(s));
        }
        return sb.toString();
    }

    protected void appendDetails(StringBuilder sb) {
    }
}
