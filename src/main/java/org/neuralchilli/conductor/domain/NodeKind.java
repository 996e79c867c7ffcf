package org.neuralchilli.conductor.domain;

import java.util.Locale;

/**
 * Kind of a unit of work. Fixed when the node is created.
 */
public enum NodeKind {
    STEP,
    WORKFLOW,
    /**
     * Owns a pipeline of child steps
     */
    MODEL,
    LIFECYCLE,
    GOAL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static NodeKind fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Node kind cannot be null or empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown node kind: " + value, e);
        }
    }
}
