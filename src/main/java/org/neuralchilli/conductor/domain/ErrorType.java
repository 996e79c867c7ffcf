package org.neuralchilli.conductor.domain;

/**
 * Error categories reported on the errors channel.
 */
public enum ErrorType {
    DEPENDENCY_ERROR("dependency_error", "Dependency Error"),
    CONFIGURATION_ERROR("configuration_error", "Configuration Error"),
    EXECUTION_ERROR("execution_error", "Task Execution Error"),
    TASK_GROUP_EXECUTION_ERROR("task_group_execution_error", "Task Group Execution Error");

    private final String wireName;
    private final String title;

    ErrorType(String wireName, String title) {
        this.wireName = wireName;
        this.title = title;
    }

    public String wireName() {
        return wireName;
    }

    public String title() {
        return title;
    }
}
