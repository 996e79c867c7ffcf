package org.neuralchilli.conductor.domain;

import java.util.List;

/**
 * Thrown when dependencies cannot be looked up or are not met when execution is requested.
 * The resolver treats it as "not yet ready" rather than as a failure.
 */
public class DependencyException extends OrchestrationException {

    private final List<String> missingDependencies;

    public DependencyException(String message, String taskName, List<String> missingDependencies) {
        super(ErrorType.DEPENDENCY_ERROR, message, taskName,
                List.of("Check that a task group registered a producer for each missing key",
                        "Check that the producing task declares the key in result_keys"),
                null);
        this.missingDependencies = missingDependencies != null ? List.copyOf(missingDependencies) : List.of();
    }

    public DependencyException(String message, Throwable cause) {
        super(ErrorType.DEPENDENCY_ERROR, message, null, List.of(), cause);
        this.missingDependencies = List.of();
    }

    public List<String> missingDependencies() {
        return missingDependencies;
    }

    @Override
    protected void appendDetails(StringBuilder sb) {
        if (!missingDependencies.isEmpty()) {
            sb.append("\nMissing dependencies: ").append(String.join(", ", missingDependencies));
        }
    }
}
