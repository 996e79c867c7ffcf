package org.neuralchilli.conductor.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ContextMergerTest {

    @Test
    void shouldMergeNestedMapsKeyByKey() {
        // Given
        Map<String, Object> target = new LinkedHashMap<>();
        target.put("config", new LinkedHashMap<>(Map.of("a", 1, "b", 2)));

        // When
        ContextMerger.deepMerge(target, Map.of("config", Map.of("b", 3, "c", 4)));

        // Then
        assertThat(target.get("config")).isEqualTo(Map.of("a", 1, "b", 3, "c", 4));
    }

    @Test
    void shouldReplaceListsInsteadOfConcatenating() {
        Map<String, Object> target = new LinkedHashMap<>();
        target.put("items", List.of("a", "b"));

        ContextMerger.deepMerge(target, Map.of("items", List.of("c")));

        assertThat(target.get("items")).isEqualTo(List.of("c"));
    }

    @Test
    void shouldReplaceScalarWithMap() {
        Map<String, Object> target = new LinkedHashMap<>();
        target.put("topic", "queues");

        ContextMerger.deepMerge(target, Map.of("topic", Map.of("name", "queues")));

        assertThat(target.get("topic")).isEqualTo(Map.of("name", "queues"));
    }

    @Test
    void shouldNotShareMutableStructureWithSource() {
        // Given
        List<Object> items = new ArrayList<>(List.of("a"));
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("items", items);
        Map<String, Object> target = new LinkedHashMap<>();

        // When
        ContextMerger.deepMerge(target, source);
        items.add("b");

        // Then
        assertThat(target.get("items")).isEqualTo(List.of("a"));
    }

    @Test
    void shouldIgnoreNullSource() {
        Map<String, Object> target = new LinkedHashMap<>(Map.of("a", 1));

        assertThat(ContextMerger.deepMerge(target, null)).isEqualTo(Map.of("a", 1));
    }

    @Test
    void shouldDropInternalKeysWhenSerializing() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("context_info", Map.of("input_description", "x"));
        context.put("task_groups", List.of());
        context.put("facts", List.of("f1"));

        assertThat(ContextMerger.serialize(context)).containsOnlyKeys("facts");
    }

    @Test
    void shouldReduceValuesToJsonTypes() {
        // Given
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("count", 3);
        context.put("mode", Thread.State.RUNNABLE);
        context.put("timeout", Duration.ofSeconds(5));
        context.put("tags", java.util.Set.of("x"));

        // When
        Map<String, Object> serialized = ContextMerger.serialize(context);

        // Then
        assertThat(serialized).containsEntry("count", 3)
                .containsEntry("mode", "RUNNABLE")
                .containsEntry("tags", List.of("x"));
        assertThat(serialized.get("timeout")).isNotNull();
    }
}
