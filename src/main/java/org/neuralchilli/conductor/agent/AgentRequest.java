package org.neuralchilli.conductor.agent;

import java.util.List;

/**
 * Everything an agent gets for one call.
 *
 * @param attempt 1 for the first call, incremented on each re-prompt
 */
public record AgentRequest(
        String taskName,
        String agentName,
        String message,
        String instructions,
        List<AgentTool> tools,
        List<String> resultKeys,
        List<String> optionalResultKeys,
        String sessionId,
        int attempt
) {
    public AgentRequest {
        tools = tools != null ? List.copyOf(tools) : List.of();
        resultKeys = resultKeys != null ? List.copyOf(resultKeys) : List.of();
        optionalResultKeys = optionalResultKeys != null ? List.copyOf(optionalResultKeys) : List.of();
    }

    /**
     * Same request with a different message, for re-prompting.
     */
    public AgentRequest retry(String newMessage) {
        return new AgentRequest(taskName, agentName, newMessage, instructions, tools,
                resultKeys, optionalResultKeys, sessionId, attempt + 1);
    }
}
