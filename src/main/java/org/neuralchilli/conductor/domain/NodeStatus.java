package org.neuralchilli.conductor.domain;

import java.util.Locale;

/**
 * Lifecycle status of a unit of work.
 * Declaration order is the forward transition order; FAILED sits outside of it.
 */
public enum NodeStatus {
    CREATED,
    PENDING,
    PRE_INITIALIZING,
    INITIALIZING,
    INITIALIZED,
    RESOLVING_DEPENDENCIES,
    DEPENDENCIES_RESOLVED,
    READY,
    ASSIGNING,
    ASSIGNED,
    PRE_EXECUTE,
    EXECUTING,
    MONITORING,
    COMPLETED,

    /**
     * Reachable from any non-terminal status
     */
    FAILED;

    /**
     * Check if this is a terminal state (node finished)
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Check whether a node in this status may move to {@code next}.
     * Staying put is not a transition.
     */
    public boolean canTransitionTo(NodeStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.ordinal() > ordinal();
    }

    /**
     * Hyphenated form used in published status events, e.g. "pre-initializing".
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static NodeStatus fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Node status cannot be null or empty");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
