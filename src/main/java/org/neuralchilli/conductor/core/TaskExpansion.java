package org.neuralchilli.conductor.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.conductor.domain.ExpansionConfig;
import org.neuralchilli.conductor.domain.TaskInfo;
import org.neuralchilli.conductor.messaging.MessageCodec;
import org.neuralchilli.conductor.monitoring.SchedulerMetrics;
import org.neuralchilli.conductor.util.PathValues;
import org.neuralchilli.conductor.util.TemplateRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fans a task with an expansion config out into one task per element of an array dependency.
 * <p>
 * When no array can be found the task comes back unexpanded and the result is flagged
 * degraded; expansion never throws for missing data.
 */
@ApplicationScoped
public class TaskExpansion {

    private static final Logger log = LoggerFactory.getLogger(TaskExpansion.class);

    /**
     * Placeholder filled by scalar items when no identifiers are configured
     */
    static final String DEFAULT_PLACEHOLDER = "url";

    private final MessageCodec codec;
    private final SchedulerMetrics metrics;

    @Inject
    public TaskExpansion(MessageCodec codec, SchedulerMetrics metrics) {
        this.codec = codec;
        this.metrics = metrics;
    }

    /**
     * Outcome of one expansion.
     *
     * @param tasks          the expanded tasks, or the original task when nothing was expanded
     * @param expanded       whether {@code tasks} are clones
     * @param degradedReason why an expandable task was left as is, null otherwise
     */
    public record ExpansionResult(List<TaskInfo> tasks, boolean expanded, String degradedReason) {

        public ExpansionResult {
            tasks = List.copyOf(tasks);
        }

        static ExpansionResult unchanged(TaskInfo task) {
            return new ExpansionResult(List.of(task), false, null);
        }

        static ExpansionResult degraded(TaskInfo task, String reason) {
            return new ExpansionResult(List.of(task), false, reason);
        }

        public boolean isDegraded() {
            return degradedReason != null;
        }
    }

    private record ArrayDependency(String name, List<?> items) {
    }

    /**
     * Expand {@code task} against {@code context}, which is either a map or its JSON string form.
     */
    public ExpansionResult expand(TaskInfo task, Object context) {
        if (!task.hasExpansion()) {
            return ExpansionResult.unchanged(task);
        }

        Map<String, Object> values;
        try {
            values = asContextMap(context);
        } catch (IllegalArgumentException e) {
            return degrade(task, "context is not a JSON object: " + e.getMessage());
        }

        List<ArrayDependency> arrays = findArrayDependencies(task, values);
        if (arrays.isEmpty()) {
            log.debug("No array dependency for {} on first pass, decoding context values", task.name());
            values = reparseValues(values);
            arrays = findArrayDependencies(task, values);
        }
        if (arrays.isEmpty()) {
            return degrade(task, "no array value found for " + task.expansionConfig().arrayMapping().values());
        }

        ExpansionConfig config = task.expansionConfig();
        List<TaskInfo> clones = new ArrayList<>();
        int counter = 0;
        for (ArrayDependency array : arrays) {
            for (Object item : array.items()) {
                Map<String, Object> replacements = replacementsFor(config, array.name(), item);
                if (replacements.isEmpty()) {
                    log.debug("Skipping item of '{}' with nothing to substitute: {}", array.name(), item);
                    continue;
                }
                Map<String, Object> vars = new LinkedHashMap<>(values);
                vars.putAll(replacements);
                counter++;
                clones.add(task.expandedCopy(counter,
                        TemplateRenderer.render(task.messageTemplate(), vars),
                        TemplateRenderer.render(task.sharedInstructions(), vars)));
            }
        }

        if (clones.isEmpty()) {
            return degrade(task, "array dependencies had no usable items");
        }

        log.info("Expanded task {} into {} tasks", task.name(), clones.size());
        metrics.recordExpansion(clones.size());
        return new ExpansionResult(clones, true, null);
    }

    /**
     * Merge the result maps of expanded tasks. Lists extend, scalars append, so every
     * key of the aggregate is a list.
     */
    public static Map<String, Object> aggregate(List<Map<String, Object>> results) {
        Map<String, List<Object>> merged = new LinkedHashMap<>();
        for (Map<String, Object> result : results) {
            if (result == null) {
                continue;
            }
            for (Map.Entry<String, Object> entry : result.entrySet()) {
                List<Object> target = merged.computeIfAbsent(entry.getKey(), k -> new ArrayList<>());
                if (entry.getValue() instanceof Collection) {
                    target.addAll((Collection<?>) entry.getValue());
                } else {
                    target.add(entry.getValue());
                }
            }
        }
        return new LinkedHashMap<>(merged);
    }

    private ExpansionResult degrade(TaskInfo task, String reason) {
        log.warn("Task {} was not expanded: {}", task.name(), reason);
        metrics.recordDegradedExpansion();
        return ExpansionResult.degraded(task, reason);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asContextMap(Object context) {
        if (context == null) {
            return Map.of();
        }
        if (context instanceof String) {
            return codec.decodeMap((String) context);
        }
        if (context instanceof Map) {
            return (Map<String, Object>) context;
        }
        throw new IllegalArgumentException("unsupported context type " + context.getClass().getName());
    }

    private List<ArrayDependency> findArrayDependencies(TaskInfo task, Map<String, Object> values) {
        List<ArrayDependency> arrays = new ArrayList<>();
        for (String dependency : task.allDependencies()) {
            if (!task.expansionConfig().mapsDependency(dependency)) {
                continue;
            }
            Object value = values.get(dependency);
            if (value instanceof String) {
                value = codec.tryDecodeEncoded((String) value).orElse(value);
            }
            if (value instanceof List) {
                arrays.add(new ArrayDependency(dependency, (List<?>) value));
            }
        }
        return arrays;
    }

    /**
     * Decode string values that hold JSON, twice to undo double encoding.
     */
    private Map<String, Object> reparseValues(Map<String, Object> values) {
        Map<String, Object> decoded = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            Object value = entry.getValue();
            for (int pass = 0; pass < 2 && value instanceof String; pass++) {
                Optional<Object> parsed = codec.tryDecodeEncoded((String) value);
                if (parsed.isEmpty()) {
                    break;
                }
                value = parsed.get();
            }
            decoded.put(entry.getKey(), value);
        }
        return decoded;
    }

    private Map<String, Object> replacementsFor(ExpansionConfig config, String dependency, Object item) {
        Map<String, Object> replacements = new LinkedHashMap<>();
        boolean scalar = !(item instanceof Map) && !(item instanceof List);

        if (config.identifiers().isEmpty()) {
            if (scalar && item != null) {
                replacements.put(DEFAULT_PLACEHOLDER, item);
            } else if (item instanceof Map) {
                ((Map<?, ?>) item).forEach((k, v) -> {
                    if (v != null) {
                        replacements.put(String.valueOf(k), v);
                    }
                });
            }
            return replacements;
        }

        for (Map.Entry<String, String> identifier : config.identifiers().entrySet()) {
            String path = identifier.getValue();
            String logicalName = PathValues.head(path);
            Object value;
            if (config.arrayMapping().containsKey(logicalName)) {
                if (!dependency.equals(config.arrayMapping().get(logicalName))) {
                    continue;
                }
                value = PathValues.resolve(item, PathValues.tail(path));
            } else {
                value = scalar ? item : PathValues.resolve(item, path);
            }
            if (value != null) {
                replacements.put(identifier.getKey(), value);
            }
        }
        return replacements;
    }
}
