package org.neuralchilli.conductor.domain;

import org.neuralchilli.conductor.core.ContextMerger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured context carried by a node or a task group.
 * The output and context maps are mutated only through the synchronized merge methods.
 */
public final class ContextInfo {

    private final String inputDescription;
    private final String actionSummary;
    private final String outcomeDescription;
    private final List<String> feedback = new ArrayList<>();
    private final Map<String, Object> output = new LinkedHashMap<>();
    private final Map<String, Object> context = new LinkedHashMap<>();

    public ContextInfo(
            String inputDescription,
            String actionSummary,
            String outcomeDescription,
            List<String> feedback,
            Map<String, Object> output,
            Map<String, Object> context
    ) {
        this.inputDescription = inputDescription;
        this.actionSummary = actionSummary;
        this.outcomeDescription = outcomeDescription;
        if (feedback != null) {
            this.feedback.addAll(feedback);
        }
        if (output != null) {
            ContextMerger.deepMerge(this.output, output);
        }
        if (context != null) {
            ContextMerger.deepMerge(this.context, context);
        }
    }

    public static ContextInfo empty() {
        return new ContextInfo(null, null, null, List.of(), Map.of(), Map.of());
    }

    public static ContextInfo withContext(Map<String, Object> context) {
        return new ContextInfo(null, null, null, List.of(), Map.of(), context);
    }

    /**
     * Build from a decoded payload. Accepts snake_case and camelCase keys.
     */
    @SuppressWarnings("unchecked")
    public static ContextInfo fromMap(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return empty();
        }
        List<String> feedback = new ArrayList<>();
        Object rawFeedback = data.get("feedback");
        if (rawFeedback instanceof List) {
            ((List<Object>) rawFeedback).forEach(f -> feedback.add(String.valueOf(f)));
        }
        return new ContextInfo(
                asString(first(data, "input_description", "inputDescription")),
                asString(first(data, "action_summary", "actionSummary")),
                asString(first(data, "outcome_description", "outcomeDescription")),
                feedback,
                asMap(data.get("output")),
                asMap(data.get("context"))
        );
    }

    public String inputDescription() {
        return inputDescription;
    }

    public String actionSummary() {
        return actionSummary;
    }

    public String outcomeDescription() {
        return outcomeDescription;
    }

    public synchronized List<String> feedback() {
        return List.copyOf(feedback);
    }

    public synchronized void addFeedback(String entry) {
        if (entry != null && !entry.isBlank()) {
            feedback.add(entry);
        }
    }

    /**
     * Deep copy of the output map.
     */
    public synchronized Map<String, Object> output() {
        return ContextMerger.deepCopy(output);
    }

    /**
     * Deep copy of the context map.
     */
    public synchronized Map<String, Object> context() {
        return ContextMerger.deepCopy(context);
    }

    public synchronized void mergeOutput(Map<String, Object> values) {
        ContextMerger.deepMerge(output, values);
    }

    public synchronized void mergeContext(Map<String, Object> values) {
        ContextMerger.deepMerge(context, values);
    }

    public synchronized Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("input_description", inputDescription);
        payload.put("action_summary", actionSummary);
        payload.put("outcome_description", outcomeDescription);
        payload.put("feedback", List.copyOf(feedback));
        payload.put("output", ContextMerger.deepCopy(output));
        payload.put("context", ContextMerger.deepCopy(context));
        return payload;
    }

    private static Object first(Map<String, Object> data, String snake, String camel) {
        Object value = data.get(snake);
        return value != null ? value : data.get(camel);
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }
}
