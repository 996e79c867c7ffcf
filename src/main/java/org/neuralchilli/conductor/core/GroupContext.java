package org.neuralchilli.conductor.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shared context owned by one task group.
 * Every mutation goes through {@link #mergeInto(Map)}; concurrent merges are last-writer-wins per leaf.
 */
public final class GroupContext {

    private final Map<String, Object> values = new LinkedHashMap<>();

    public GroupContext(Map<String, ?> initial) {
        ContextMerger.deepMerge(values, initial);
    }

    public synchronized void mergeInto(Map<String, ?> partial) {
        ContextMerger.deepMerge(values, partial);
    }

    public void put(String key, Object value) {
        Map<String, Object> single = new LinkedHashMap<>();
        single.put(key, value);
        mergeInto(single);
    }

    public synchronized Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public synchronized boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public synchronized Set<String> keys() {
        return Set.copyOf(values.keySet());
    }

    /**
     * Deep copy, safe to hand to agents and other threads.
     */
    public synchronized Map<String, Object> snapshot() {
        return ContextMerger.deepCopy(values);
    }

    /**
     * Snapshot reduced to what may be published or persisted.
     */
    public Map<String, Object> serialized() {
        return ContextMerger.serialize(snapshot());
    }
}
