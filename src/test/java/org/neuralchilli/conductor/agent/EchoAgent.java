package org.neuralchilli.conductor.agent;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Answers every result key with the rendered message.
 */
@ApplicationScoped
public class EchoAgent implements AgentExecutor {

    @Override
    public String name() {
        return "echo";
    }

    @Override
    public Map<String, Object> execute(AgentRequest request, Map<String, Object> context) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : request.resultKeys()) {
            result.put(key, request.message());
        }
        return result;
    }
}
