package org.neuralchilli.conductor.config;

import java.time.Duration;

/**
 * Plain config for tests that wire components by hand.
 */
public record TestConductorConfig(
        Duration groupTimeout,
        Duration fallbackPollInterval,
        String channelScope,
        String controlTopic,
        boolean listenForControlMessages,
        int workerThreads,
        int expansionThreads,
        int maxAgentAttempts,
        boolean trialRun
) implements ConductorConfig {

    public static TestConductorConfig defaults() {
        return new TestConductorConfig(Duration.ofSeconds(10), Duration.ofMillis(500), "task_group_execute",
                "agency_action", false, 4, 2, 2, false);
    }

    public TestConductorConfig withGroupTimeout(Duration timeout) {
        return new TestConductorConfig(timeout, fallbackPollInterval, channelScope, controlTopic,
                listenForControlMessages, workerThreads, expansionThreads, maxAgentAttempts, trialRun);
    }

    public TestConductorConfig withTrialRun(boolean enabled) {
        return new TestConductorConfig(groupTimeout, fallbackPollInterval, channelScope, controlTopic,
                listenForControlMessages, workerThreads, expansionThreads, maxAgentAttempts, enabled);
    }

    public TestConductorConfig withMaxAgentAttempts(int attempts) {
        return new TestConductorConfig(groupTimeout, fallbackPollInterval, channelScope, controlTopic,
                listenForControlMessages, workerThreads, expansionThreads, attempts, trialRun);
    }
}
