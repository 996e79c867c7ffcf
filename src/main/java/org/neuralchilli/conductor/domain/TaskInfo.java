package org.neuralchilli.conductor.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One executable task inside a task group.
 * Validated on construction; any violation is a {@link ConfigurationException}.
 */
public record TaskInfo(
        String key,
        String name,
        String agentClass,
        String sharedInstructions,
        List<String> resultKeys,
        List<String> optionalResultKeys,
        List<String> tools,
        String messageTemplate,
        List<String> dependencies,
        List<String> optionalDependencies,
        String validatorPrompt,
        String validatorTool,
        ExpansionConfig expansionConfig,
        boolean expandedTask,
        String parentTaskKey
) {
    public static final String VALIDATOR_TOOL_SUFFIX = "Tool";

    public TaskInfo {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Task name cannot be null or empty",
                    null, "name", List.of("Give every task a unique name within its group"));
        }
        if (agentClass == null || agentClass.isBlank()) {
            throw new ConfigurationException("Agent class cannot be empty",
                    name, "agent_class", List.of("Set agent_class to the name of a registered agent"));
        }
        if (messageTemplate == null || messageTemplate.isBlank()) {
            throw new ConfigurationException("Message template cannot be empty",
                    name, "message_template", List.of("Provide the message sent to the agent"));
        }
        if (resultKeys == null || resultKeys.isEmpty()) {
            throw new ConfigurationException("At least one result key is required",
                    name, "result_keys", List.of("Declare the keys this task produces in result_keys"));
        }

        tools = copyNonBlank(tools, name, "tools",
                "Tool names must be non-empty strings");
        resultKeys = copyNonBlank(resultKeys, name, "result_keys",
                "Result keys must be non-empty strings");
        optionalResultKeys = copyNonBlank(optionalResultKeys, name, "optional_result_keys",
                "Optional result keys must be non-empty strings");
        dependencies = copyNonBlank(dependencies, name, "dependencies",
                "Dependency names must be non-empty strings");
        optionalDependencies = copyNonBlank(optionalDependencies, name, "optional_dependencies",
                "Dependency names must be non-empty strings");

        boolean hasPrompt = validatorPrompt != null && !validatorPrompt.isBlank();
        boolean hasTool = validatorTool != null && !validatorTool.isBlank();
        if (hasPrompt != hasTool) {
            throw new ConfigurationException("Validator prompt and validator tool must be set together",
                    name, hasTool ? "validator_prompt" : "validator_tool",
                    List.of("Set both validator_prompt and validator_tool, or neither"));
        }
        if (hasTool && !validatorTool.endsWith(VALIDATOR_TOOL_SUFFIX)) {
            throw new ConfigurationException("Validator tool name must end with '" + VALIDATOR_TOOL_SUFFIX + "'",
                    name, "validator_tool",
                    List.of("Rename the validator tool, e.g. '" + validatorTool + VALIDATOR_TOOL_SUFFIX + "'"));
        }

        // Defaults
        if (key == null || key.isBlank()) {
            key = "task:" + name;
        }
        if (sharedInstructions == null) {
            sharedInstructions = "";
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public boolean hasExpansion() {
        return expansionConfig != null;
    }

    public boolean hasValidator() {
        return validatorTool != null && !validatorTool.isBlank();
    }

    /**
     * Required followed by optional result keys, without duplicates.
     */
    public List<String> allResultKeys() {
        Set<String> keys = new LinkedHashSet<>(resultKeys);
        keys.addAll(optionalResultKeys);
        return List.copyOf(keys);
    }

    /**
     * Required followed by optional dependency names, without duplicates.
     */
    public List<String> allDependencies() {
        Set<String> names = new LinkedHashSet<>(dependencies);
        names.addAll(optionalDependencies);
        return List.copyOf(names);
    }

    /**
     * Clone produced by expansion: renamed, rendered and never expanded again.
     */
    public TaskInfo expandedCopy(int index, String renderedMessage, String renderedInstructions) {
        return new TaskInfo(
                key + "_" + index,
                name + "_" + index,
                agentClass,
                renderedInstructions,
                resultKeys,
                optionalResultKeys,
                tools,
                renderedMessage,
                dependencies,
                optionalDependencies,
                validatorPrompt,
                validatorTool,
                null,
                true,
                key
        );
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("key", key);
        payload.put("name", name);
        payload.put("agent_class", agentClass);
        payload.put("shared_instructions", sharedInstructions);
        payload.put("result_keys", resultKeys);
        payload.put("optional_result_keys", optionalResultKeys);
        payload.put("tools", tools);
        payload.put("message_template", messageTemplate);
        payload.put("dependencies", dependencies);
        payload.put("optional_dependencies", optionalDependencies);
        payload.put("validator_prompt", validatorPrompt);
        payload.put("validator_tool", validatorTool);
        payload.put("expansion_config", expansionConfig != null ? expansionConfig.toPayload() : null);
        payload.put("is_expanded_task", expandedTask);
        payload.put("parent_task_key", parentTaskKey);
        return payload;
    }

    private static List<String> copyNonBlank(List<String> values, String taskName, String field, String problem) {
        if (values == null) {
            return List.of();
        }
        List<String> copy = new ArrayList<>(values.size());
        for (Object value : values) {
            if (!(value instanceof String) || ((String) value).isBlank()) {
                throw new ConfigurationException(problem + ", got: " + value,
                        taskName, field, List.of("Remove empty or non-string entries from " + field));
            }
            copy.add((String) value);
        }
        return List.copyOf(copy);
    }

    public static class Builder {
        private String key;
        private final String name;
        private String agentClass;
        private String sharedInstructions = "";
        private List<String> resultKeys = List.of();
        private List<String> optionalResultKeys = List.of();
        private List<String> tools = List.of();
        private String messageTemplate;
        private List<String> dependencies = List.of();
        private List<String> optionalDependencies = List.of();
        private String validatorPrompt;
        private String validatorTool;
        private ExpansionConfig expansionConfig;

        public Builder(String name) {
            this.name = name;
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder agentClass(String agentClass) {
            this.agentClass = agentClass;
            return this;
        }

        public Builder sharedInstructions(String sharedInstructions) {
            this.sharedInstructions = sharedInstructions;
            return this;
        }

        public Builder resultKeys(String... resultKeys) {
            this.resultKeys = List.of(resultKeys);
            return this;
        }

        public Builder optionalResultKeys(String... optionalResultKeys) {
            this.optionalResultKeys = List.of(optionalResultKeys);
            return this;
        }

        public Builder tools(String... tools) {
            this.tools = List.of(tools);
            return this;
        }

        public Builder messageTemplate(String messageTemplate) {
            this.messageTemplate = messageTemplate;
            return this;
        }

        public Builder dependencies(String... dependencies) {
            this.dependencies = List.of(dependencies);
            return this;
        }

        public Builder optionalDependencies(String... optionalDependencies) {
            this.optionalDependencies = List.of(optionalDependencies);
            return this;
        }

        public Builder validator(String prompt, String tool) {
            this.validatorPrompt = prompt;
            this.validatorTool = tool;
            return this;
        }

        public Builder expansion(ExpansionConfig expansionConfig) {
            this.expansionConfig = expansionConfig;
            return this;
        }

        public TaskInfo build() {
            return new TaskInfo(key, name, agentClass, sharedInstructions, resultKeys,
                    optionalResultKeys, tools, messageTemplate, dependencies, optionalDependencies,
                    validatorPrompt, validatorTool, expansionConfig, false, null);
        }
    }
}
