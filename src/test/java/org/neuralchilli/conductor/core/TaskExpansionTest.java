package org.neuralchilli.conductor.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.conductor.domain.ExpansionConfig;
import org.neuralchilli.conductor.domain.TaskInfo;
import org.neuralchilli.conductor.messaging.MessageCodec;
import org.neuralchilli.conductor.monitoring.SchedulerMetrics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TaskExpansionTest {

    private final MessageCodec codec = new MessageCodec();
    private SchedulerMetrics metrics;
    private TaskExpansion expansion;

    @BeforeEach
    void setup() {
        metrics = new SchedulerMetrics();
        expansion = new TaskExpansion(codec, metrics);
    }

    private static TaskInfo fetchTask(Map<String, String> identifiers) {
        return TaskInfo.builder("fetch")
                .agentClass("Fetcher")
                .messageTemplate("Fetch {url}")
                .resultKeys("pages")
                .dependencies("urls")
                .expansion(new ExpansionConfig(Map.of("urls", "urls"), identifiers))
                .build();
    }

    @Test
    void shouldCreateOneTaskPerArrayItem() {
        // Given
        TaskInfo task = fetchTask(Map.of());
        Map<String, Object> context = Map.of("urls", List.of("http://a", "http://b", "http://c"));

        // When
        TaskExpansion.ExpansionResult result = expansion.expand(task, context);

        // Then
        assertThat(result.expanded()).isTrue();
        assertThat(result.isDegraded()).isFalse();
        assertThat(result.tasks()).extracting(TaskInfo::name).containsExactly("fetch_1", "fetch_2", "fetch_3");
        assertThat(result.tasks()).extracting(TaskInfo::messageTemplate)
                .containsExactly("Fetch http://a", "Fetch http://b", "Fetch http://c");
        assertThat(result.tasks()).allSatisfy(t -> {
            assertThat(t.expandedTask()).isTrue();
            assertThat(t.parentTaskKey()).isEqualTo("task:fetch");
        });
    }

    @Test
    void shouldNumberClonesConsecutivelyWhenItemsAreSkipped() {
        // Given: the middle item has nothing to substitute
        TaskInfo task = fetchTask(Map.of());
        Map<String, Object> context = Map.of("urls", List.of("http://a", List.of(), "http://c"));

        // When
        TaskExpansion.ExpansionResult result = expansion.expand(task, context);

        // Then
        assertThat(result.tasks()).extracting(TaskInfo::name).containsExactly("fetch_1", "fetch_2");
        assertThat(result.tasks()).extracting(TaskInfo::messageTemplate)
                .containsExactly("Fetch http://a", "Fetch http://c");
    }

    @Test
    void shouldLeaveTaskWithoutExpansionConfigUnchanged() {
        TaskInfo task = TaskInfo.builder("plain")
                .agentClass("Writer")
                .messageTemplate("Write")
                .resultKeys("draft")
                .build();

        TaskExpansion.ExpansionResult result = expansion.expand(task, Map.of());

        assertThat(result.tasks()).containsExactly(task);
        assertThat(result.expanded()).isFalse();
        assertThat(result.isDegraded()).isFalse();
    }

    @Test
    void shouldReturnDegradedResultWhenArrayIsMissing() {
        // Given
        TaskInfo task = fetchTask(Map.of());

        // When
        TaskExpansion.ExpansionResult result = expansion.expand(task, Map.of("urls", "not a list"));

        // Then
        assertThat(result.tasks()).containsExactly(task);
        assertThat(result.expanded()).isFalse();
        assertThat(result.isDegraded()).isTrue();
        assertThat(result.degradedReason()).contains("urls");
        assertThat(metrics.degradedExpansions()).isEqualTo(1);
    }

    @Test
    void shouldDegradeOnContextThatIsNotJson() {
        TaskExpansion.ExpansionResult result = expansion.expand(fetchTask(Map.of()), "{broken");

        assertThat(result.isDegraded()).isTrue();
        assertThat(result.tasks()).hasSize(1);
    }

    @Test
    void shouldAcceptContextAsJsonString() {
        String context = codec.encode(Map.of("urls", List.of("http://a", "http://b")));

        TaskExpansion.ExpansionResult result = expansion.expand(fetchTask(Map.of()), context);

        assertThat(result.tasks()).hasSize(2);
    }

    @Test
    void shouldDecodeDoubleEncodedArrays() {
        // Given
        String once = codec.encode(List.of("http://a", "http://b"));
        String twice = codec.encode(once);

        // When
        TaskExpansion.ExpansionResult result = expansion.expand(fetchTask(Map.of()), Map.of("urls", twice));

        // Then
        assertThat(result.tasks()).extracting(TaskInfo::messageTemplate)
                .containsExactly("Fetch http://a", "Fetch http://b");
    }

    @Test
    void shouldDecodeBytesLiteralArrays() {
        TaskExpansion.ExpansionResult result = expansion.expand(fetchTask(Map.of()),
                Map.of("urls", "b'[\"http://a\"]'"));

        assertThat(result.tasks()).extracting(TaskInfo::messageTemplate).containsExactly("Fetch http://a");
    }

    @Test
    void shouldResolveDottedIdentifiersAgainstItems() {
        // Given
        TaskInfo task = TaskInfo.builder("summarize")
                .agentClass("Writer")
                .messageTemplate("Summarize {title} at {link}")
                .resultKeys("summaries")
                .dependencies("search_results")
                .expansion(new ExpansionConfig(
                        Map.of("articles", "search_results"),
                        Map.of("title", "articles.meta.title", "link", "href")))
                .build();
        Map<String, Object> context = Map.of("search_results", List.of(
                Map.of("href", "http://a", "meta", Map.of("title", "Queues")),
                Map.of("href", "http://b", "meta", Map.of("title", "Caches"))));

        // When
        TaskExpansion.ExpansionResult result = expansion.expand(task, context);

        // Then
        assertThat(result.tasks()).extracting(TaskInfo::messageTemplate)
                .containsExactly("Summarize Queues at http://a", "Summarize Caches at http://b");
    }

    @Test
    void shouldUseMapItemKeysWhenNoIdentifiersAreConfigured() {
        TaskInfo task = TaskInfo.builder("fetch")
                .agentClass("Fetcher")
                .messageTemplate("Fetch {url} as {format}")
                .resultKeys("pages")
                .dependencies("targets")
                .expansion(new ExpansionConfig(Map.of("targets", "targets"), Map.of()))
                .build();

        TaskExpansion.ExpansionResult result = expansion.expand(task,
                Map.of("targets", List.of(Map.of("url", "http://a", "format", "pdf"))));

        assertThat(result.tasks()).extracting(TaskInfo::messageTemplate).containsExactly("Fetch http://a as pdf");
    }

    @Test
    void shouldConcatenateExpandedResults() {
        // Given
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("pages", List.of("p1", "p2"));
        first.put("status", "ok");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("pages", List.of("p3"));
        second.put("status", "partial");

        // When
        Map<String, Object> aggregated = TaskExpansion.aggregate(List.of(first, second, Map.of("pages", List.of())));

        // Then
        assertThat(aggregated.get("pages")).isEqualTo(List.of("p1", "p2", "p3"));
        assertThat(aggregated.get("status")).isEqualTo(List.of("ok", "partial"));
    }
}
