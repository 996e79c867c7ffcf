package org.neuralchilli.conductor.agent;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.neuralchilli.conductor.domain.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to implementation lookup for agents and tools.
 * Filled from CDI beans at startup and by explicit registration.
 */
@ApplicationScoped
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, AgentExecutor> agents = new ConcurrentHashMap<>();
    private final Map<String, AgentTool> tools = new ConcurrentHashMap<>();

    @Inject
    Instance<AgentExecutor> agentBeans;

    @Inject
    Instance<AgentTool> toolBeans;

    @PostConstruct
    void init() {
        if (agentBeans != null) {
            agentBeans.forEach(this::register);
        }
        if (toolBeans != null) {
            toolBeans.forEach(this::registerTool);
        }
        log.info("Agent registry ready: {} agents, {} tools", agents.size(), tools.size());
    }

    public void register(AgentExecutor executor) {
        register(executor.name(), executor);
    }

    public void register(String name, AgentExecutor executor) {
        AgentExecutor previous = agents.put(name, executor);
        if (previous != null && previous != executor) {
            log.warn("Agent '{}' re-registered, replacing {}", name, previous.getClass().getSimpleName());
        } else {
            log.debug("Registered agent '{}'", name);
        }
    }

    public void registerTool(AgentTool tool) {
        tools.put(tool.name(), tool);
        log.debug("Registered tool '{}'", tool.name());
    }

    public AgentExecutor agent(String name) {
        AgentExecutor executor = agents.get(name);
        if (executor == null) {
            throw new ConfigurationException("Unknown agent class: " + name, null, "agent_class",
                    List.of("Register an AgentExecutor named '" + name + "'",
                            "Known agents: " + Set.copyOf(agents.keySet())));
        }
        return executor;
    }

    public AgentTool tool(String name) {
        AgentTool tool = tools.get(name);
        if (tool == null) {
            throw new ConfigurationException("Unknown tool: " + name, null, "tools",
                    List.of("Register an AgentTool named '" + name + "'"));
        }
        return tool;
    }

    public List<AgentTool> tools(List<String> names) {
        List<AgentTool> resolved = new ArrayList<>(names.size());
        for (String name : names) {
            resolved.add(tool(name));
        }
        return resolved;
    }

    public Set<String> agentNames() {
        return Set.copyOf(agents.keySet());
    }
}
