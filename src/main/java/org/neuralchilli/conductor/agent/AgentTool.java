package org.neuralchilli.conductor.agent;

import java.util.Map;

/**
 * A named tool handed to agents. Validator tools are tools whose name ends with "Tool".
 */
public interface AgentTool {

    String name();

    Object invoke(Map<String, Object> args) throws Exception;
}
