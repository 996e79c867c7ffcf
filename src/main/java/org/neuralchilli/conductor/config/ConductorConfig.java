package org.neuralchilli.conductor.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Scheduler settings, read from {@code conductor.*}.
 */
@ConfigMapping(prefix = "conductor")
public interface ConductorConfig {

    /**
     * Overall deadline of one task group run
     */
    @WithDefault("PT30M")
    Duration groupTimeout();

    /**
     * Upper bound on how long a group waits for a signal before re-running its cycle
     */
    @WithDefault("PT5S")
    Duration fallbackPollInterval();

    /**
     * First segment of per-result notification channels
     */
    @WithDefault("task_group_execute")
    String channelScope();

    @WithDefault("agency_action")
    String controlTopic();

    @WithDefault("true")
    boolean listenForControlMessages();

    @WithDefault("8")
    int workerThreads();

    @WithDefault("4")
    int expansionThreads();

    /**
     * Agent calls per task when required result keys come back missing
     */
    @WithDefault("2")
    int maxAgentAttempts();

    /**
     * Log what would run and return placeholder results instead of calling agents
     */
    @WithDefault("false")
    boolean trialRun();
}
