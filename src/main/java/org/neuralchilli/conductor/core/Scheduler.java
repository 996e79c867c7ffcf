package org.neuralchilli.conductor.core;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.conductor.config.ConductorConfig;
import org.neuralchilli.conductor.config.GroupDefinitionParser;
import org.neuralchilli.conductor.domain.ConfigurationException;
import org.neuralchilli.conductor.domain.ControlMessage;
import org.neuralchilli.conductor.domain.ErrorType;
import org.neuralchilli.conductor.domain.GroupResult;
import org.neuralchilli.conductor.domain.GroupStatus;
import org.neuralchilli.conductor.domain.OrchestrationException;
import org.neuralchilli.conductor.domain.TaskGroupDefinition;
import org.neuralchilli.conductor.domain.TaskGroupExecutionException;
import org.neuralchilli.conductor.messaging.Channels;
import org.neuralchilli.conductor.messaging.MessageBroker;
import org.neuralchilli.conductor.messaging.MessageCodec;
import org.neuralchilli.conductor.messaging.Subscription;
import org.neuralchilli.conductor.monitoring.SchedulerMetrics;
import org.neuralchilli.conductor.service.GroupDefinitionValidator;
import org.neuralchilli.conductor.store.StateStore;
import org.neuralchilli.conductor.worker.TaskRunner;
import org.neuralchilli.conductor.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for running task groups.
 * Turns control messages into group runs and publishes their final results.
 */
@ApplicationScoped
public class Scheduler {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final StateStore store;
    private final MessageBroker broker;
    private final MessageCodec codec;
    private final DependencyRegistry registry;
    private final WorkerPool workerPool;
    private final NodeLifecycle nodes;
    private final GroupDefinitionParser parser;
    private final GroupDefinitionValidator validator;
    private final SchedulerMetrics metrics;
    private final ConductorConfig config;
    private final TaskGroupServices services;

    private final Map<String, TaskGroup> activeGroups = new ConcurrentHashMap<>();
    private volatile Subscription controlSubscription;

    @Inject
    public Scheduler(
            StateStore store,
            MessageBroker broker,
            MessageCodec codec,
            DependencyRegistry registry,
            SessionContexts sessions,
            TaskRunner runner,
            WorkerPool workerPool,
            NodeLifecycle nodes,
            GroupDefinitionParser parser,
            GroupDefinitionValidator validator,
            SchedulerMetrics metrics,
            ConductorConfig config
    ) {
        this.store = store;
        this.broker = broker;
        this.codec = codec;
        this.registry = registry;
        this.workerPool = workerPool;
        this.nodes = nodes;
        this.parser = parser;
        this.validator = validator;
        this.metrics = metrics;
        this.config = config;
        this.services = new TaskGroupServices(store, broker, codec, registry, sessions, runner, workerPool,
                metrics, config.channelScope(), config.fallbackPollInterval());
    }

    void onStart(@Observes StartupEvent event) {
        if (!config.listenForControlMessages()) {
            log.info("Control message listener disabled");
            return;
        }
        controlSubscription = broker.subscribe(config.controlTopic(), this::onControlMessage);
        log.info("Listening for control messages on '{}'", config.controlTopic());
    }

    void onStop(@Observes ShutdownEvent event) {
        Subscription subscription = controlSubscription;
        if (subscription != null) {
            try {
                broker.unsubscribe(subscription);
            } catch (RuntimeException e) {
                log.warn("Error unsubscribing from control topic", e);
            }
        }
        metrics.logReport();
    }

    /**
     * Validate a definition and build its group without running it.
     *
     * @throws ConfigurationException if the definition is invalid
     */
    public TaskGroup createGroup(TaskGroupDefinition definition, Map<String, ?> context) {
        validator.validate(definition);
        return new TaskGroup(definition, context, services);
    }

    /**
     * Run a group on the calling thread and publish its final result.
     *
     * @throws TaskGroupExecutionException if the group times out or fails
     */
    public GroupResult runGroup(TaskGroupDefinition definition, Map<String, ?> context) {
        GroupResult result = execute(definition, context);
        publishFinal(result.toPayload());
        return result;
    }

    /**
     * Run a group on the group pool.
     */
    public CompletableFuture<GroupResult> submit(TaskGroupDefinition definition, Map<String, ?> context) {
        return CompletableFuture.supplyAsync(() -> runGroup(definition, context), workerPool.groupExecutor());
    }

    /**
     * Run several groups of one session concurrently. Every group's result keys are
     * registered before any group starts, so cross-group dependencies resolve from the
     * first cycle. The future always completes normally, one result per group.
     */
    public CompletableFuture<List<GroupResult>> launchSession(
            String sessionId,
            List<TaskGroupDefinition> groups,
            Map<String, ?> context
    ) {
        groups.forEach(validator::validate);
        groups.forEach(registry::registerGroup);
        log.info("Launching {} task groups for session {}", groups.size(), sessionId);

        List<CompletableFuture<GroupResult>> futures = new ArrayList<>();
        for (TaskGroupDefinition group : groups) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> execute(group, context), workerPool.groupExecutor())
                    .handle((result, error) -> result != null ? result : failedResult(group, error)));
        }

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<GroupResult> results = new ArrayList<>();
                    futures.forEach(f -> results.add(f.join()));
                    publishFinal(sessionSummary(sessionId, results));
                    return results;
                });
    }

    /**
     * Act on a control message.
     *
     * @return the run started by the message, or empty if the message was ignored
     * @throws ConfigurationException if the message does not describe a valid group
     */
    @SuppressWarnings("unchecked")
    public Optional<CompletableFuture<?>> handle(ControlMessage message) {
        if (!message.isInitialize()) {
            log.info("Ignoring control message '{}' with action '{}'", message.key(), message.action());
            return Optional.empty();
        }

        String sessionId = sessionIdOf(message);
        if (message.isSessionLaunch()) {
            List<TaskGroupDefinition> groups = new ArrayList<>();
            for (Object raw : (Iterable<Object>) message.object().get("task_groups")) {
                groups.add(parser.fromMap(asMap(raw, "task_groups"), sessionId));
            }
            if (groups.isEmpty()) {
                throw new ConfigurationException("Session launch carries no task groups",
                        null, "task_groups", List.of("Add at least one group to task_groups"));
            }
            return Optional.<CompletableFuture<?>>of(launchSession(groups.get(0).sessionId(), groups, message.context()));
        }

        TaskGroupDefinition definition = parser.fromMap(message.object(), sessionId);
        validator.validate(definition);
        log.info("Initializing task group '{}' ({}) for session {}",
                definition.name(), definition.id(), definition.sessionId());
        return Optional.<CompletableFuture<?>>of(submit(definition, message.context()));
    }

    /**
     * Release the session's node subscriptions and delete every stored key of the session. Best-effort.
     *
     * @return number of keys deleted
     */
    public int cleanupSession(String sessionId) {
        try {
            nodes.releaseSession(sessionId);
        } catch (RuntimeException e) {
            log.warn("Releasing nodes of session {} failed: {}", sessionId, e.getMessage());
        }
        try {
            int deleted = store.deleteByPattern(Channels.sessionPattern(sessionId));
            log.info("Cleaned up {} keys of session {}", deleted, sessionId);
            return deleted;
        } catch (RuntimeException e) {
            log.warn("Cleanup of session {} failed: {}", sessionId, e.getMessage());
            return 0;
        }
    }

    public Set<String> activeGroups() {
        return Set.copyOf(activeGroups.keySet());
    }

    public Optional<TaskGroup> activeGroup(String groupId) {
        return Optional.ofNullable(activeGroups.get(groupId));
    }

    private GroupResult execute(TaskGroupDefinition definition, Map<String, ?> context) {
        TaskGroup group = createGroup(definition, context);
        activeGroups.put(group.id(), group);
        try {
            return group.process(config.groupTimeout());
        } finally {
            activeGroups.remove(group.id());
        }
    }

    @SuppressWarnings("unchecked")
    void onControlMessage(String channel, String payload) {
        try {
            Map<String, Object> raw = codec.decodeMap(payload);
            ControlMessage message = new ControlMessage(
                    stringOrNull(raw.get("key")),
                    stringOrNull(raw.get("action")),
                    raw.get("object") != null ? asMap(raw.get("object"), "object") : null,
                    raw.get("context") != null ? asMap(raw.get("context"), "context") : null
            );
            handle(message).ifPresent(run -> run.whenComplete((result, error) -> {
                if (error != null) {
                    log.error("Run started by control message '{}' failed", message.key(), unwrap(error));
                }
            }));
        } catch (OrchestrationException | IllegalArgumentException e) {
            log.error("Rejected control message on {}: {}", channel, e.getMessage());
            Map<String, Object> report = new LinkedHashMap<>();
            report.put("error_type", ErrorType.CONFIGURATION_ERROR.wireName());
            report.put("error", e.getMessage());
            report.put("channel", channel);
            report.put("timestamp", Instant.now().toString());
            if (e instanceof OrchestrationException) {
                report.put("report", ((OrchestrationException) e).toReport());
            }
            publish(Channels.ERRORS, report);
        }
    }

    private GroupResult failedResult(TaskGroupDefinition group, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TaskGroupExecutionException) {
            TaskGroupExecutionException failure = (TaskGroupExecutionException) cause;
            return new GroupResult(group.id(), group.name(), group.sessionId(),
                    failure.timedOut() ? GroupStatus.TIMED_OUT : GroupStatus.FAILED,
                    failure.completedTasks(), failure.failedTasks(), failure.partialContext(), null);
        }
        log.error("Task group '{}' failed unexpectedly", group.name(), cause);
        return new GroupResult(group.id(), group.name(), group.sessionId(), GroupStatus.FAILED,
                null, null, null, null);
    }

    private Map<String, Object> sessionSummary(String sessionId, List<GroupResult> results) {
        boolean allCompleted = results.stream().allMatch(GroupResult::isCompleted);
        Map<String, Object> context = new LinkedHashMap<>();
        List<Map<String, Object>> groups = new ArrayList<>();
        for (GroupResult result : results) {
            ContextMerger.deepMerge(context, result.context());
            Map<String, Object> group = new LinkedHashMap<>(result.toPayload());
            group.remove("context");
            groups.add(group);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("status", allCompleted ? "completed" : "partial");
        summary.put("session_id", sessionId);
        summary.put("groups", groups);
        summary.put("context", context);
        summary.put("timestamp", Instant.now().toString());
        return summary;
    }

    private void publishFinal(Map<String, Object> payload) {
        publish(Channels.AGENCY_TASK_GROUP_COMPLETED, payload);
    }

    private void publish(String channel, Map<String, Object> payload) {
        try {
            broker.publish(channel, codec.encode(payload));
        } catch (RuntimeException e) {
            log.warn("Could not publish to {}: {}", channel, e.getMessage());
        }
    }

    private static String sessionIdOf(ControlMessage message) {
        Object sessionId = message.object().get("session_id");
        if (sessionId == null) {
            sessionId = message.context().get("session_id");
        }
        return sessionId != null ? sessionId.toString() : null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String field) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Control message field '" + field + "' must be an object",
                    null, field, List.of("Send '" + field + "' as a JSON object"));
        }
        return (Map<String, Object>) value;
    }

    private static String stringOrNull(Object value) {
        return value != null ? value.toString() : null;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
