package org.neuralchilli.conductor.agent;

import java.util.Map;

/**
 * An agent that turns a rendered task message into result values.
 * Implementations are called from several worker threads at once.
 */
public interface AgentExecutor {

    /**
     * Name used by {@code agent_class} in task definitions
     */
    String name();

    Map<String, Object> execute(AgentRequest request, Map<String, Object> context) throws Exception;
}
