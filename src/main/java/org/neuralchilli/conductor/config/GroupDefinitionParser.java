package org.neuralchilli.conductor.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.conductor.domain.ConfigurationException;
import org.neuralchilli.conductor.domain.ContextInfo;
import org.neuralchilli.conductor.domain.ExpansionConfig;
import org.neuralchilli.conductor.domain.TaskGroupDefinition;
import org.neuralchilli.conductor.domain.TaskInfo;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns YAML documents and decoded control-message payloads into task group definitions.
 * Both use the same snake_case keys; camelCase aliases are accepted.
 */
@ApplicationScoped
public class GroupDefinitionParser {

    /**
     * Parse a task group definition from a YAML string
     */
    public TaskGroupDefinition parse(String yamlContent) {
        return fromMap(load(yamlContent));
    }

    /**
     * Parse a task group definition from an InputStream
     */
    public TaskGroupDefinition parse(InputStream inputStream) {
        try {
            Map<String, Object> data = new Yaml().load(inputStream);
            return fromMap(data);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML group definition: " + e.getMessage(), e);
        }
    }

    /**
     * Build a definition from an already decoded map.
     * {@code sessionIdFallback} is used when the map carries no session id.
     */
    @SuppressWarnings("unchecked")
    public TaskGroupDefinition fromMap(Map<String, Object> data, String sessionIdFallback) {
        if (data == null) {
            throw new ConfigurationException("Task group definition is empty");
        }
        String sessionId = getString(data, "session_id", "sessionId");
        if (sessionId == null) {
            sessionId = sessionIdFallback;
        }

        Object rawTasks = data.get("tasks");
        if (!(rawTasks instanceof List)) {
            throw new ConfigurationException("Task group must define a list of tasks",
                    null, "tasks", List.of("Add a 'tasks' list to the group definition"));
        }
        List<TaskInfo> tasks = new ArrayList<>();
        for (Object rawTask : (List<Object>) rawTasks) {
            if (!(rawTask instanceof Map)) {
                throw new ConfigurationException("Task entries must be maps, got: " + rawTask,
                        null, "tasks", List.of("Describe each task as a map of fields"));
            }
            tasks.add(parseTask((Map<String, Object>) rawTask));
        }

        Object rawContextInfo = first(data, "context_info", "contextInfo");
        ContextInfo contextInfo = rawContextInfo instanceof Map
                ? ContextInfo.fromMap((Map<String, Object>) rawContextInfo)
                : ContextInfo.empty();

        return new TaskGroupDefinition(
                getString(data, "id", "id"),
                getString(data, "key", "key"),
                getString(data, "name", "name"),
                sessionId,
                tasks,
                contextInfo
        );
    }

    public TaskGroupDefinition fromMap(Map<String, Object> data) {
        return fromMap(data, null);
    }

    /**
     * Parse a single task definition.
     */
    @SuppressWarnings("unchecked")
    public TaskInfo parseTask(Map<String, Object> data) {
        ExpansionConfig expansion = null;
        Object rawExpansion = first(data, "expansion_config", "expansionConfig");
        if (rawExpansion instanceof Map) {
            expansion = parseExpansion(getString(data, "name", "name"), (Map<String, Object>) rawExpansion);
        }

        return new TaskInfo(
                getString(data, "key", "key"),
                getString(data, "name", "name"),
                getString(data, "agent_class", "agentClass"),
                getString(data, "shared_instructions", "sharedInstructions"),
                getList(data, "result_keys", "resultKeys"),
                getList(data, "optional_result_keys", "optionalResultKeys"),
                getList(data, "tools", "tools"),
                getString(data, "message_template", "messageTemplate"),
                getList(data, "dependencies", "dependencies"),
                getList(data, "optional_dependencies", "optionalDependencies"),
                getString(data, "validator_prompt", "validatorPrompt"),
                getString(data, "validator_tool", "validatorTool"),
                expansion,
                false,
                null
        );
    }

    private ExpansionConfig parseExpansion(String taskName, Map<String, Object> data) {
        Map<String, String> arrayMapping = getStringMap(data, "array_mapping", "arrayMapping");
        if (arrayMapping.isEmpty()) {
            throw new ConfigurationException("Expansion config requires an array_mapping",
                    taskName, "expansion_config",
                    List.of("Map a logical array name to the dependency holding the array"));
        }
        return new ExpansionConfig(arrayMapping, getStringMap(data, "identifiers", "identifiers"));
    }

    private Map<String, Object> load(String yamlContent) {
        try {
            return new Yaml().load(yamlContent);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Invalid YAML group definition: " + e.getMessage(), e);
        }
    }

    // Helper methods for type-safe extraction

    private static Object first(Map<String, Object> map, String key, String alias) {
        Object value = map.get(key);
        return value != null ? value : map.get(alias);
    }

    private static String getString(Map<String, Object> map, String key, String alias) {
        Object value = first(map, key, alias);
        return value != null ? value.toString() : null;
    }

    /**
     * Elements are kept as-is so that TaskInfo can reject non-string entries.
     */
    @SuppressWarnings("unchecked")
    private static List<String> getList(Map<String, Object> map, String key, String alias) {
        Object value = first(map, key, alias);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List) {
            return new ArrayList<>((List<String>) value);
        }
        if (value instanceof String) {
            return List.of((String) value);
        }
        throw new ConfigurationException("Field '" + key + "' must be a list, got: " + value,
                getString(map, "name", "name"), key, List.of("Write " + key + " as a YAML/JSON list"));
    }

    private static Map<String, String> getStringMap(Map<String, Object> map, String key, String alias) {
        Object value = first(map, key, alias);
        if (!(value instanceof Map)) {
            return Map.of();
        }
        Map<String, String> result = new HashMap<>();
        ((Map<?, ?>) value).forEach((k, v) ->
                result.put(k.toString(), v != null ? v.toString() : null));
        return result;
    }
}
