package org.neuralchilli.conductor.core;

import org.neuralchilli.conductor.messaging.MessageBroker;
import org.neuralchilli.conductor.messaging.MessageCodec;
import org.neuralchilli.conductor.monitoring.SchedulerMetrics;
import org.neuralchilli.conductor.store.StateStore;
import org.neuralchilli.conductor.worker.TaskRunner;
import org.neuralchilli.conductor.worker.WorkerPool;

import java.time.Duration;

/**
 * Collaborators a {@link TaskGroup} runs against, handed over by the {@link Scheduler}.
 */
public record TaskGroupServices(
        StateStore store,
        MessageBroker broker,
        MessageCodec codec,
        DependencyRegistry registry,
        SessionContexts sessions,
        TaskRunner runner,
        WorkerPool workerPool,
        SchedulerMetrics metrics,
        String scope,
        Duration fallbackPollInterval
) {
    public TaskGroupServices {
        if (scope == null || scope.isBlank()) {
            throw new IllegalArgumentException("Channel scope cannot be empty");
        }
        if (fallbackPollInterval == null || fallbackPollInterval.isNegative() || fallbackPollInterval.isZero()) {
            throw new IllegalArgumentException("Fallback poll interval must be positive");
        }
    }
}
