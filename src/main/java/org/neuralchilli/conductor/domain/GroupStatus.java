package org.neuralchilli.conductor.domain;

/**
 * Lifecycle status of a task group run.
 */
public enum GroupStatus {
    /**
     * Group created, result keys not registered yet
     */
    CREATED,

    /**
     * Cycles are running
     */
    RUNNING,

    /**
     * Every task completed
     */
    COMPLETED,

    /**
     * Deadline passed before every task completed
     */
    TIMED_OUT,

    /**
     * Group bookkeeping failed
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == TIMED_OUT || this == FAILED;
    }
}
