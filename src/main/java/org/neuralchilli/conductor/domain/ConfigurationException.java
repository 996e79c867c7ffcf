package org.neuralchilli.conductor.domain;

import java.util.List;

/**
 * Thrown when a task or group definition is malformed, or names an agent or tool
 * that is not registered. Never retried.
 */
public class ConfigurationException extends OrchestrationException {

    private final String field;

    public ConfigurationException(String message) {
        this(message, null, null, List.of());
    }

    public ConfigurationException(String message, String taskName, String field, List<String> suggestions) {
        super(ErrorType.CONFIGURATION_ERROR, message, taskName, suggestions, null);
        this.field = field;
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorType.CONFIGURATION_ERROR, message, null, List.of(), cause);
        this.field = null;
    }

    public String field() {
        return field;
    }

    @Override
    protected void appendDetails(StringBuilder sb) {
        if (field != null) {
            sb.append("\nField: ").append(field);
        }
    }
}
