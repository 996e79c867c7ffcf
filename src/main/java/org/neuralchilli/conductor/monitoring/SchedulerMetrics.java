package org.neuralchilli.conductor.monitoring;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process counters for the scheduler.
 *
 * Tracks:
 * - task launches, completions and failures
 * - duplicate dependency deliveries ignored by resolvers
 * - expansions, including degraded ones that fell back to the unexpanded task
 * - group outcomes and per-operation timings
 */
@ApplicationScoped
public class SchedulerMetrics {

    private static final Logger log = LoggerFactory.getLogger(SchedulerMetrics.class);

    private final LongAdder tasksLaunched = new LongAdder();
    private final LongAdder tasksCompleted = new LongAdder();
    private final LongAdder tasksFailed = new LongAdder();

    private final LongAdder dependenciesSatisfied = new LongAdder();
    private final LongAdder duplicateDeliveries = new LongAdder();

    private final LongAdder expansions = new LongAdder();
    private final LongAdder expandedTasks = new LongAdder();
    private final LongAdder degradedExpansions = new LongAdder();

    private final LongAdder groupsCompleted = new LongAdder();
    private final LongAdder groupsTimedOut = new LongAdder();

    private final LongAdder signalWakeups = new LongAdder();
    private final LongAdder fallbackPolls = new LongAdder();

    private final Map<String, TimingStats> timingStats = new ConcurrentHashMap<>();

    public void recordTaskLaunched() {
        tasksLaunched.increment();
    }

    public void recordTaskCompleted() {
        tasksCompleted.increment();
    }

    public void recordTaskFailed() {
        tasksFailed.increment();
    }

    public void recordDependencySatisfied() {
        dependenciesSatisfied.increment();
    }

    /**
     * Record a redelivered dependency notification that was ignored.
     */
    public void recordDuplicateDelivery() {
        duplicateDeliveries.increment();
    }

    /**
     * Record a successful fan-out into {@code count} tasks.
     */
    public void recordExpansion(int count) {
        expansions.increment();
        expandedTasks.add(count);
    }

    /**
     * Record an expansion that found nothing to expand and kept the original task.
     */
    public void recordDegradedExpansion() {
        degradedExpansions.increment();
    }

    public void recordGroupCompleted() {
        groupsCompleted.increment();
    }

    public void recordGroupTimedOut() {
        groupsTimedOut.increment();
    }

    /**
     * Record a group cycle woken by a signal.
     */
    public void recordSignalWakeup() {
        signalWakeups.increment();
    }

    /**
     * Record a group cycle woken by the fallback poll.
     */
    public void recordFallbackPoll() {
        fallbackPolls.increment();
    }

    public long duplicateDeliveries() {
        return duplicateDeliveries.sum();
    }

    public long degradedExpansions() {
        return degradedExpansions.sum();
    }

    public long tasksLaunched() {
        return tasksLaunched.sum();
    }

    /**
     * Get task success rate.
     */
    public double getTaskSuccessRate() {
        long completed = tasksCompleted.sum();
        long failed = tasksFailed.sum();
        long total = completed + failed;
        return total > 0 ? (completed * 100.0) / total : 0.0;
    }

    /**
     * Start timing an operation.
     *
     * @param operation Operation name
     * @return Timer handle to stop timing
     */
    public Timer startTimer(String operation) {
        return new Timer(operation, Instant.now());
    }

    public class Timer {
        private final String operation;
        private final Instant start;

        private Timer(String operation, Instant start) {
            this.operation = operation;
            this.start = start;
        }

        public void stop() {
            recordTiming(operation, Duration.between(start, Instant.now()));
        }
    }

    private void recordTiming(String operation, Duration duration) {
        timingStats.computeIfAbsent(operation, key -> new TimingStats()).record(duration);
    }

    public TimingStats getTimingStats(String operation) {
        return timingStats.getOrDefault(operation, new TimingStats());
    }

    /**
     * Statistics for operation timing.
     */
    public static class TimingStats {
        private final LongAdder count = new LongAdder();
        private final LongAdder totalNanos = new LongAdder();
        private final AtomicLong maxNanos = new AtomicLong(0);

        void record(Duration duration) {
            long nanos = duration.toNanos();
            count.increment();
            totalNanos.add(nanos);
            maxNanos.updateAndGet(current -> Math.max(current, nanos));
        }

        public long getCount() {
            return count.sum();
        }

        public Duration getAverage() {
            long cnt = count.sum();
            return cnt > 0 ? Duration.ofNanos(totalNanos.sum() / cnt) : Duration.ZERO;
        }

        public Duration getMax() {
            return Duration.ofNanos(maxNanos.get());
        }

        @Override
        public String toString() {
            return String.format("TimingStats[count=%d, avg=%dms, max=%dms]",
                    getCount(), getAverage().toMillis(), getMax().toMillis());
        }
    }

    public MetricsReport getReport() {
        return new MetricsReport(
                tasksLaunched.sum(),
                tasksCompleted.sum(),
                tasksFailed.sum(),
                getTaskSuccessRate(),
                dependenciesSatisfied.sum(),
                duplicateDeliveries.sum(),
                expansions.sum(),
                expandedTasks.sum(),
                degradedExpansions.sum(),
                groupsCompleted.sum(),
                groupsTimedOut.sum(),
                signalWakeups.sum(),
                fallbackPolls.sum()
        );
    }

    public record MetricsReport(
            long tasksLaunched,
            long tasksCompleted,
            long tasksFailed,
            double taskSuccessRate,
            long dependenciesSatisfied,
            long duplicateDeliveries,
            long expansions,
            long expandedTasks,
            long degradedExpansions,
            long groupsCompleted,
            long groupsTimedOut,
            long signalWakeups,
            long fallbackPolls
    ) {
        @Override
        public String toString() {
            return String.format("""
                Scheduler Report:
                =================
                Tasks:
                  Launched: %d, Completed: %d, Failed: %d (success %.1f%%)

                Dependencies:
                  Satisfied: %d, Duplicate deliveries ignored: %d

                Expansion:
                  Expansions: %d into %d tasks, Degraded: %d

                Groups:
                  Completed: %d, Timed out: %d
                  Wakeups: %d signalled, %d fallback polls
                """,
                    tasksLaunched, tasksCompleted, tasksFailed, taskSuccessRate,
                    dependenciesSatisfied, duplicateDeliveries,
                    expansions, expandedTasks, degradedExpansions,
                    groupsCompleted, groupsTimedOut,
                    signalWakeups, fallbackPolls
            );
        }
    }

    /**
     * Reset all metrics (useful for testing).
     */
    public void reset() {
        tasksLaunched.reset();
        tasksCompleted.reset();
        tasksFailed.reset();
        dependenciesSatisfied.reset();
        duplicateDeliveries.reset();
        expansions.reset();
        expandedTasks.reset();
        degradedExpansions.reset();
        groupsCompleted.reset();
        groupsTimedOut.reset();
        signalWakeups.reset();
        fallbackPolls.reset();
        timingStats.clear();
        log.info("Scheduler metrics reset");
    }

    public void logReport() {
        log.info("\n{}", getReport());
    }
}
