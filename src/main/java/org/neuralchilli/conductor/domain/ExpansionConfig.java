package org.neuralchilli.conductor.domain;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fan-out settings for a task.
 *
 * @param arrayMapping logical array name to the dependency key holding the array
 * @param identifiers  placeholder to dotted path into each array item, optionally
 *                     prefixed with the logical array name
 */
public record ExpansionConfig(
        Map<String, String> arrayMapping,
        Map<String, String> identifiers
) {
    public ExpansionConfig {
        if (arrayMapping == null || arrayMapping.isEmpty()) {
            throw new IllegalArgumentException("Expansion config requires at least one array mapping");
        }
        arrayMapping = Map.copyOf(arrayMapping);
        identifiers = identifiers != null ? Map.copyOf(identifiers) : Map.of();
    }

    public boolean mapsDependency(String dependencyName) {
        return arrayMapping.containsValue(dependencyName);
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("array_mapping", arrayMapping);
        payload.put("identifiers", identifiers);
        return payload;
    }
}
