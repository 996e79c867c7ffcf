package org.neuralchilli.conductor.core;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Map merging and serialization rules for shared context.
 * <p>
 * Nested maps merge key by key; every other value, lists included, is replaced by the
 * incoming value. Lists are only ever concatenated by expansion aggregation, never here.
 */
public final class ContextMerger {

    /**
     * Bookkeeping keys that never leave the process.
     */
    public static final Set<String> INTERNAL_KEYS = Set.of("context_info", "task_groups");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ContextMerger() {
    }

    /**
     * Merge {@code source} into {@code target} in place.
     *
     * @return {@code target}
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> deepMerge(Map<String, Object> target, Map<String, ?> source) {
        if (source == null) {
            return target;
        }
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            Object incoming = entry.getValue();
            Object existing = target.get(entry.getKey());
            if (incoming instanceof Map && existing instanceof Map) {
                Map<String, Object> nested = new LinkedHashMap<>((Map<String, Object>) existing);
                deepMerge(nested, (Map<String, Object>) incoming);
                target.put(entry.getKey(), nested);
            } else {
                target.put(entry.getKey(), deepCopyValue(incoming));
            }
        }
        return target;
    }

    /**
     * Copy nested maps and lists so the result shares no mutable structure with {@code source}.
     */
    public static Map<String, Object> deepCopy(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((k, v) -> copy.put(k, deepCopyValue(v)));
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object deepCopyValue(Object value) {
        if (value instanceof Map) {
            return deepCopy((Map<String, ?>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                copy.add(deepCopyValue(item));
            }
            return copy;
        }
        return value;
    }

    /**
     * Serializable view of a context: internal keys removed, every value reduced to
     * JSON types. Values that cannot be represented are stringified, never dropped.
     */
    public static Map<String, Object> serialize(Map<String, ?> context) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (context == null) {
            return result;
        }
        for (Map.Entry<String, ?> entry : context.entrySet()) {
            if (INTERNAL_KEYS.contains(entry.getKey())) {
                continue;
            }
            result.put(entry.getKey(), toSerializable(entry.getValue()));
        }
        return result;
    }

    private static Object toSerializable(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> nested.put(String.valueOf(k), toSerializable(v)));
            return nested;
        }
        if (value instanceof Collection) {
            List<Object> items = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                items.add(toSerializable(item));
            }
            return items;
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        try {
            return MAPPER.convertValue(value, Object.class);
        } catch (IllegalArgumentException e) {
            return String.valueOf(value);
        }
    }
}
