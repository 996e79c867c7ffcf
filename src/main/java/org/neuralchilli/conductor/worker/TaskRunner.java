package org.neuralchilli.conductor.worker;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.conductor.agent.AgentExecutor;
import org.neuralchilli.conductor.agent.AgentRegistry;
import org.neuralchilli.conductor.agent.AgentRequest;
import org.neuralchilli.conductor.agent.AgentTool;
import org.neuralchilli.conductor.config.ConductorConfig;
import org.neuralchilli.conductor.core.TaskExpansion;
import org.neuralchilli.conductor.core.TaskExpansion.ExpansionResult;
import org.neuralchilli.conductor.domain.OrchestrationException;
import org.neuralchilli.conductor.domain.TaskExecutionException;
import org.neuralchilli.conductor.domain.TaskInfo;
import org.neuralchilli.conductor.monitoring.SchedulerMetrics;
import org.neuralchilli.conductor.util.TemplateRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs one task: expansion if configured, then the agent.
 * Supports trial-run mode for checking group wiring without calling agents.
 */
@ApplicationScoped
public class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final AgentRegistry agents;
    private final TaskExpansion expansion;
    private final WorkerPool workerPool;
    private final ConductorConfig config;
    private final SchedulerMetrics metrics;

    @Inject
    public TaskRunner(
            AgentRegistry agents,
            TaskExpansion expansion,
            WorkerPool workerPool,
            ConductorConfig config,
            SchedulerMetrics metrics
    ) {
        this.agents = agents;
        this.expansion = expansion;
        this.workerPool = workerPool;
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Execute a task against a context snapshot.
     *
     * @return the task's result keys and their values
     * @throws TaskExecutionException if the agent fails or required results are missing
     */
    public Map<String, Object> run(TaskInfo task, Map<String, Object> context, String sessionId) {
        ExpansionResult result = expansion.expand(task, context);
        if (!result.expanded()) {
            return runSingle(task, context, sessionId);
        }

        List<CompletableFuture<Map<String, Object>>> futures = new ArrayList<>();
        for (TaskInfo item : result.tasks()) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> runSingle(item, context, sessionId), workerPool.expansionExecutor()));
        }

        List<Map<String, Object>> itemResults = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<Map<String, Object>> future : futures) {
                itemResults.add(future.join());
            }
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TaskExecutionException("Expanded item of " + task.name() + " failed: " + cause.getMessage(),
                    task.name(), cause);
        }

        log.info("Task {} completed {} expanded items", task.name(), itemResults.size());
        return TaskExpansion.aggregate(itemResults);
    }

    private Map<String, Object> runSingle(TaskInfo task, Map<String, Object> context, String sessionId) {
        String message = TemplateRenderer.render(task.messageTemplate(), context);
        String instructions = TemplateRenderer.render(task.sharedInstructions(), context);

        if (config.trialRun()) {
            return executeTrialRun(task, message);
        }

        SchedulerMetrics.Timer timer = metrics.startTimer("agent." + task.agentClass());
        try {
            AgentExecutor agent = agents.agent(task.agentClass());
            List<AgentTool> tools = agents.tools(task.tools());

            AgentRequest request = new AgentRequest(task.name(), task.agentClass(), message, instructions,
                    tools, task.resultKeys(), task.optionalResultKeys(), sessionId, 1);

            Map<String, Object> results = callAgent(agent, request, task, context);
            for (String optional : task.optionalResultKeys()) {
                results.putIfAbsent(optional, List.of());
            }

            if (task.hasValidator()) {
                validate(task, results);
            }
            return results;
        } catch (OrchestrationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskExecutionException("Task interrupted", task.name(), e);
        } catch (Exception e) {
            throw new TaskExecutionException("Agent " + task.agentClass() + " failed: " + e.getMessage(),
                    task.name(), e);
        } finally {
            timer.stop();
        }
    }

    /**
     * Call the agent, re-prompting while required result keys are missing.
     */
    private Map<String, Object> callAgent(
            AgentExecutor agent,
            AgentRequest request,
            TaskInfo task,
            Map<String, Object> context
    ) throws Exception {
        int maxAttempts = Math.max(1, config.maxAgentAttempts());
        AgentRequest current = request;
        List<String> missing = List.of();

        while (true) {
            log.debug("Calling agent {} for {} (attempt {})", task.agentClass(), task.name(), current.attempt());
            Map<String, Object> response = agent.execute(current, context);
            Map<String, Object> results = selectResults(task, response);

            missing = missingRequired(task, results);
            if (missing.isEmpty()) {
                return results;
            }
            if (current.attempt() >= maxAttempts) {
                break;
            }
            log.warn("Agent for {} did not return {}, re-prompting", task.name(), missing);
            current = current.retry(current.message()
                    + "\n\nYour previous answer was missing these result keys: " + String.join(", ", missing)
                    + ". Return a value for every one of: " + String.join(", ", task.resultKeys()) + ".");
        }

        throw new TaskExecutionException(
                "Missing required result keys " + missing + " after " + current.attempt() + " attempts",
                task.name(),
                List.of("Check that agent '" + task.agentClass() + "' returns " + task.resultKeys(),
                        "Make the message template ask for each result key explicitly"));
    }

    private static Map<String, Object> selectResults(TaskInfo task, Map<String, Object> response) {
        Map<String, Object> results = new LinkedHashMap<>();
        if (response == null) {
            return results;
        }
        for (String key : task.allResultKeys()) {
            if (response.containsKey(key) && response.get(key) != null) {
                results.put(key, response.get(key));
            }
        }
        return results;
    }

    private static List<String> missingRequired(TaskInfo task, Map<String, Object> results) {
        List<String> missing = new ArrayList<>();
        for (String key : task.resultKeys()) {
            if (!results.containsKey(key)) {
                missing.add(key);
            }
        }
        return missing;
    }

    /**
     * The validator passes with {@code true} or {@code {"valid": true}}.
     */
    private void validate(TaskInfo task, Map<String, Object> results) throws Exception {
        AgentTool validator = agents.tool(task.validatorTool());
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("prompt", task.validatorPrompt());
        args.put("results", results);

        Object verdict = validator.invoke(args);
        boolean valid = Boolean.TRUE.equals(verdict)
                || (verdict instanceof Map && Boolean.TRUE.equals(((Map<?, ?>) verdict).get("valid")));
        if (!valid) {
            throw new TaskExecutionException("Validation by " + task.validatorTool() + " failed: " + verdict,
                    task.name(),
                    List.of("Review the validator prompt: " + task.validatorPrompt()));
        }
        log.debug("Results of {} passed {}", task.name(), task.validatorTool());
    }

    private Map<String, Object> executeTrialRun(TaskInfo task, String message) {
        log.info("═══════════════════════════════════════");
        log.info("TRIAL RUN - Would execute:");
        log.info("  Task: {}", task.name());
        log.info("  Agent: {}", task.agentClass());
        log.info("  Message: {}", message);
        log.info("  Result keys: {}", task.allResultKeys());
        log.info("═══════════════════════════════════════");

        Map<String, Object> results = new LinkedHashMap<>();
        for (String key : task.resultKeys()) {
            results.put(key, "trial_run:" + task.name() + ":" + key);
        }
        for (String key : task.optionalResultKeys()) {
            results.putIfAbsent(key, List.of());
        }
        return results;
    }
}
