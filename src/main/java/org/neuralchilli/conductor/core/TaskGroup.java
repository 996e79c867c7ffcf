package org.neuralchilli.conductor.core;

import org.neuralchilli.conductor.domain.DependencyUpdate;
import org.neuralchilli.conductor.domain.GroupResult;
import org.neuralchilli.conductor.domain.GroupStatus;
import org.neuralchilli.conductor.domain.OrchestrationException;
import org.neuralchilli.conductor.domain.TaskFailure;
import org.neuralchilli.conductor.domain.TaskGroupDefinition;
import org.neuralchilli.conductor.domain.TaskGroupExecutionException;
import org.neuralchilli.conductor.domain.TaskInfo;
import org.neuralchilli.conductor.messaging.Channels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Runs the tasks of one group as their dependencies become available.
 * <p>
 * Each cycle launches every pending task whose required dependencies have been delivered.
 * Cycles are triggered by dependency notifications and task completions through a signal
 * queue, with a slow fallback poll that also pulls in the contexts of the session's other
 * groups. The run ends when every task has completed, or with a
 * {@link TaskGroupExecutionException} once the deadline passes.
 * <p>
 * Bookkeeping sets are only touched under {@code lock}; a task name is in at most one of
 * running, completed and failed.
 */
public class TaskGroup {

    private static final Logger log = LoggerFactory.getLogger(TaskGroup.class);

    private final TaskGroupDefinition definition;
    private final TaskGroupServices services;
    private final String groupKey;
    private final GroupContext context;
    private final Map<String, TaskInfo> tasks = new LinkedHashMap<>();
    private final DependencyResolver resolver;

    private final ReentrantLock lock = new ReentrantLock();
    private final Set<String> running = new LinkedHashSet<>();
    private final Set<String> completed = new LinkedHashSet<>();
    private final Set<String> failed = new LinkedHashSet<>();
    private final List<TaskFailure> failures = new ArrayList<>();

    private final BlockingQueue<String> signals = new LinkedBlockingQueue<>();
    private volatile GroupStatus status = GroupStatus.CREATED;

    /**
     * Bookkeeping snapshot.
     */
    public record State(GroupStatus status, Set<String> running, Set<String> completed, Set<String> failed) {
    }

    public TaskGroup(TaskGroupDefinition definition, Map<String, ?> initialContext, TaskGroupServices services) {
        this.definition = definition;
        this.services = services;
        this.groupKey = definition.groupKey(services.scope());
        this.context = new GroupContext(definition.contextInfo().context());
        if (initialContext != null) {
            context.mergeInto(initialContext);
        }
        definition.tasks().forEach(task -> tasks.put(task.name(), task));
        this.resolver = new DependencyResolver(
                definition.sessionId(),
                services.scope(),
                services.registry(),
                services.broker(),
                services.codec(),
                services.metrics(),
                this::onDependencySatisfied,
                null
        );
    }

    public String id() {
        return definition.id();
    }

    public String name() {
        return definition.name();
    }

    public String sessionId() {
        return definition.sessionId();
    }

    public String groupKey() {
        return groupKey;
    }

    public GroupStatus status() {
        return status;
    }

    public GroupContext context() {
        return context;
    }

    /**
     * Run the group until every task has completed.
     *
     * @return the completed result, also published on the group's completion channel
     * @throws TaskGroupExecutionException on timeout, interruption or a bookkeeping failure
     */
    public GroupResult process(Duration timeout) {
        Instant deadline = Instant.now().plus(timeout);
        log.info("Starting task group '{}' ({}) with {} tasks, timeout {}",
                name(), id(), tasks.size(), timeout);

        try {
            status = GroupStatus.RUNNING;
            services.registry().registerGroup(definition);
            resolver.markAvailable(context.snapshot());
            syncSession();
            persistState();

            while (true) {
                runCycle();
                if (isComplete()) {
                    return complete();
                }

                long remaining = Duration.between(Instant.now(), deadline).toMillis();
                if (remaining <= 0) {
                    throw timeout(timeout);
                }

                long wait = Math.min(remaining, services.fallbackPollInterval().toMillis());
                String signal = signals.poll(wait, TimeUnit.MILLISECONDS);
                if (signal == null) {
                    services.metrics().recordFallbackPoll();
                    syncSession();
                } else {
                    log.trace("Group {} woke on {}", id(), signal);
                    services.metrics().recordSignalWakeup();
                    signals.clear();
                }
            }
        } catch (TaskGroupExecutionException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw abort("Task group '" + name() + "' interrupted", e);
        } catch (RuntimeException e) {
            throw abort("Task group '" + name() + "' failed: " + e.getMessage(), e);
        }
    }

    /**
     * Make a failed task eligible to run again.
     *
     * @return false if the task had not failed
     */
    public boolean retrigger(String taskName) {
        lock.lock();
        try {
            if (!failed.remove(taskName)) {
                return false;
            }
            failures.removeIf(f -> f.taskName().equals(taskName));
        } finally {
            lock.unlock();
        }
        log.info("Retriggering task {} in group {}", taskName, id());
        persistState();
        signals.offer("retrigger:" + taskName);
        return true;
    }

    public State snapshotState() {
        lock.lock();
        try {
            return new State(status, Set.copyOf(running), Set.copyOf(completed), Set.copyOf(failed));
        } finally {
            lock.unlock();
        }
    }

    public List<TaskFailure> failures() {
        lock.lock();
        try {
            return List.copyOf(failures);
        } finally {
            lock.unlock();
        }
    }

    /**
     * One scheduling pass: claim every ready task under the lock, then launch them.
     */
    void runCycle() {
        List<TaskInfo> ready = new ArrayList<>();
        lock.lock();
        try {
            for (TaskInfo task : tasks.values()) {
                String taskName = task.name();
                if (completed.contains(taskName) || running.contains(taskName) || failed.contains(taskName)) {
                    continue;
                }
                if (resolver.areDependenciesReady(taskName, task.dependencies(), task.optionalDependencies())) {
                    running.add(taskName);
                    ready.add(task);
                }
            }
        } finally {
            lock.unlock();
        }

        if (ready.isEmpty()) {
            log.debug("Group {}: no ready tasks this cycle", id());
            return;
        }

        persistState();
        for (TaskInfo task : ready) {
            log.info("Launching task {} of group '{}'", task.name(), name());
            services.metrics().recordTaskLaunched();
            services.workerPool().submitTask(() -> executeTask(task));
        }
    }

    private void executeTask(TaskInfo task) {
        try {
            Map<String, Object> results = services.runner().run(task, context.snapshot(), sessionId());
            onTaskSucceeded(task, results);
        } catch (RuntimeException e) {
            onTaskFailed(task, e);
        } finally {
            signals.offer("task:" + task.name());
        }
    }

    private void onTaskSucceeded(TaskInfo task, Map<String, Object> results) {
        context.mergeInto(results);

        lock.lock();
        try {
            running.remove(task.name());
            completed.add(task.name());
        } finally {
            lock.unlock();
        }
        resolver.release(task.name());
        services.metrics().recordTaskCompleted();
        log.info("Task {} of group '{}' completed", task.name(), name());

        for (String resultKey : task.allResultKeys()) {
            if (Channels.isInternalResultKey(resultKey) || !results.containsKey(resultKey)) {
                continue;
            }
            publishResult(task, resultKey, results.get(resultKey));
        }
        persistState();
    }

    private void onTaskFailed(TaskInfo task, RuntimeException error) {
        log.error("Task {} of group '{}' failed: {}", task.name(), name(), error.getMessage(), error);
        TaskFailure failure = TaskFailure.of(task.name(), error);

        lock.lock();
        try {
            running.remove(task.name());
            failed.add(task.name());
            failures.add(failure);
        } finally {
            lock.unlock();
        }
        resolver.release(task.name());
        services.metrics().recordTaskFailed();

        Map<String, Object> report = new LinkedHashMap<>(failure.toPayload());
        report.put("group_id", id());
        report.put("session_id", sessionId());
        if (error instanceof OrchestrationException) {
            report.put("report", ((OrchestrationException) error).toReport());
        }
        publish(Channels.ERRORS, report);
        persistState();
    }

    private void onDependencySatisfied(String resultKey, Object value) {
        Map<String, Object> update = new LinkedHashMap<>();
        update.put(resultKey, value);
        context.mergeInto(update);
        signals.offer("dependency:" + resultKey);
    }

    /**
     * Store the value for late subscribers, then notify the key's channel and the session.
     */
    private void publishResult(TaskInfo task, String resultKey, Object value) {
        Map<String, Object> single = new LinkedHashMap<>();
        single.put(resultKey, value);
        Object serializable = ContextMerger.serialize(single).get(resultKey);

        try {
            services.registry().recordValue(sessionId(), resultKey, serializable);
        } catch (RuntimeException e) {
            log.warn("Could not store value of '{}' for session {}: {}", resultKey, sessionId(), e.getMessage());
        }

        Map<String, Object> payload = DependencyUpdate.of(task.name(), resultKey, serializable).toPayload();
        publish(Channels.resultChannel(services.scope(), id(), resultKey), payload);
        publish(Channels.sessionResults(sessionId()), payload);
    }

    private boolean isComplete() {
        lock.lock();
        try {
            return completed.containsAll(tasks.keySet());
        } finally {
            lock.unlock();
        }
    }

    private GroupResult complete() {
        status = GroupStatus.COMPLETED;
        Map<String, Object> serialized = context.serialized();
        GroupResult result = result(GroupStatus.COMPLETED, serialized);

        publish(Channels.completion(groupKey), result.toPayload());
        try {
            services.sessions().storeContext(sessionId(), id(), serialized);
        } catch (RuntimeException e) {
            log.warn("Could not store context of group {} in session {}: {}", id(), sessionId(), e.getMessage());
        }
        services.metrics().recordGroupCompleted();
        persistState();
        resolver.close();

        log.info("Task group '{}' ({}) completed {} tasks", name(), id(), result.completedTasks().size());
        return result;
    }

    private TaskGroupExecutionException timeout(Duration timeout) {
        status = GroupStatus.TIMED_OUT;
        Map<String, Object> serialized = context.serialized();
        GroupResult partial = result(GroupStatus.TIMED_OUT, serialized);

        publish(Channels.partialResults(groupKey), partial.toPayload());
        try {
            services.sessions().storePartialResult(sessionId(), id(), partial.toPayload());
        } catch (RuntimeException e) {
            log.warn("Could not store partial results of group {}: {}", id(), e.getMessage());
        }
        services.metrics().recordGroupTimedOut();
        persistState();
        resolver.close();

        log.error("Task group '{}' ({}) timed out after {}: {} of {} tasks completed, failed {}",
                name(), id(), timeout, partial.completedTasks().size(), tasks.size(),
                partial.failedTasks().stream().map(TaskFailure::taskName).collect(Collectors.toList()));
        return new TaskGroupExecutionException(
                "Task group '" + name() + "' timed out with " + partial.completedTasks().size()
                        + " of " + tasks.size() + " tasks completed",
                id(), true, partial.failedTasks(), partial.completedTasks(), serialized, null);
    }

    private TaskGroupExecutionException abort(String message, Exception cause) {
        status = GroupStatus.FAILED;
        persistState();
        resolver.close();
        log.error(message, cause);

        State state = snapshotState();
        return new TaskGroupExecutionException(message, id(), false, failures(),
                state.completed(), context.serialized(), cause);
    }

    private GroupResult result(GroupStatus resultStatus, Map<String, Object> serialized) {
        State state = snapshotState();
        return new GroupResult(id(), name(), sessionId(), resultStatus,
                state.completed(), failures(), serialized, Instant.now());
    }

    /**
     * Pull in what other groups of the session have already produced.
     */
    private void syncSession() {
        Map<String, Object> others = services.sessions().mergedContext(sessionId(), id());
        if (others.isEmpty()) {
            return;
        }
        context.mergeInto(others);
        int marked = resolver.markAvailable(others);
        log.debug("Session sync for group {} merged {} keys, {} newly available", id(), others.size(), marked);
    }

    private void persistState() {
        State state = snapshotState();
        List<Map<String, Object>> failedPayload = new ArrayList<>();
        failures().forEach(f -> failedPayload.add(f.toPayload()));

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("status", state.status().name());
        fields.put("tasks_completed", services.codec().encode(state.completed()));
        fields.put("tasks_failed", services.codec().encode(failedPayload));
        fields.put("running_tasks", services.codec().encode(state.running()));
        try {
            services.store().putHash(Channels.groupState(id()), fields);
        } catch (RuntimeException e) {
            log.warn("Could not persist state of group {}: {}", id(), e.getMessage());
        }
    }

    private void publish(String channel, Map<String, Object> payload) {
        try {
            services.broker().publish(channel, services.codec().encode(payload));
        } catch (RuntimeException e) {
            log.warn("Could not publish to {}: {}", channel, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "TaskGroup[" + name() + ", id=" + id() + ", status=" + status + "]";
    }
}
