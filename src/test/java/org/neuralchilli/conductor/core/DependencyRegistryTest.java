package org.neuralchilli.conductor.core;

import com.hazelcast.core.HazelcastInstance;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.neuralchilli.conductor.config.TestHazelcast;
import org.neuralchilli.conductor.domain.ContextInfo;
import org.neuralchilli.conductor.domain.DependencyException;
import org.neuralchilli.conductor.domain.RegistryEntry;
import org.neuralchilli.conductor.domain.TaskGroupDefinition;
import org.neuralchilli.conductor.domain.TaskInfo;
import org.neuralchilli.conductor.messaging.Channels;
import org.neuralchilli.conductor.messaging.MessageCodec;
import org.neuralchilli.conductor.store.HazelcastStateStore;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyRegistryTest {

    private static HazelcastInstance hazelcast;
    private static HazelcastStateStore store;
    private static DependencyRegistry registry;

    @BeforeAll
    static void setup() {
        hazelcast = TestHazelcast.newInstance("registry");
        store = new HazelcastStateStore(hazelcast);
        registry = new DependencyRegistry(store, new MessageCodec());
    }

    @AfterAll
    static void cleanup() {
        if (hazelcast != null) {
            hazelcast.shutdown();
        }
    }

    private static TaskGroupDefinition group(String id, String sessionId, TaskInfo... tasks) {
        return new TaskGroupDefinition(id, null, "group-" + id, sessionId, List.of(tasks), ContextInfo.empty());
    }

    private static TaskInfo task(String name, String... resultKeys) {
        return TaskInfo.builder(name)
                .agentClass("Writer")
                .messageTemplate("Do " + name)
                .resultKeys(resultKeys)
                .dependencies("topic")
                .build();
    }

    @Test
    void shouldRegisterEveryResultKeyOfEveryTask() {
        // Given
        String session = UUID.randomUUID().toString();

        // When
        int registered = registry.registerGroup(group("g1", session,
                task("research", "facts", "sources"), task("write", "draft")));

        // Then
        assertThat(registered).isEqualTo(3);
        RegistryEntry entry = registry.lookup(session, "draft").orElseThrow();
        assertThat(entry.taskGroupId()).isEqualTo("g1");
        assertThat(entry.taskName()).isEqualTo("write");
        assertThat(entry.dependencies()).containsExactly("topic");
        assertThat(registry.entries(session)).containsOnlyKeys("facts", "sources", "draft");
    }

    @Test
    void shouldKeepFirstRegistration() {
        String session = UUID.randomUUID().toString();
        registry.registerGroup(group("g1", session, task("research", "facts")));

        int registered = registry.registerGroup(group("g2", session, task("other", "facts")));

        assertThat(registered).isZero();
        assertThat(registry.groupIdFor(session, "facts")).contains("g1");
    }

    @Test
    void shouldReturnEmptyForUnknownKey() {
        assertThat(registry.lookup(UUID.randomUUID().toString(), "nothing")).isEmpty();
    }

    @Test
    void shouldRaiseDependencyExceptionOnCorruptEntry() {
        // Given
        String session = UUID.randomUUID().toString();
        store.setField(Channels.sessionResultKeys(session), "facts", "not json");
        store.setField(Channels.sessionResultKeys(session), "draft",
                new MessageCodec().encode(Map.of("task_group_id", "g1")));

        // Then
        assertThatThrownBy(() -> registry.lookup(session, "facts"))
                .isInstanceOf(DependencyException.class)
                .hasMessageContaining("facts");
        assertThat(registry.entries(session)).containsOnlyKeys("draft");
    }

    @Test
    void shouldRecordAndFindPublishedValues() {
        String session = UUID.randomUUID().toString();

        registry.recordValue(session, "facts", List.of("f1", "f2"));
        registry.recordValue(session, "summary", "short");

        assertThat(registry.findValue(session, "facts")).contains(List.of("f1", "f2"));
        assertThat(registry.findValue(session, "summary")).contains("short");
        assertThat(registry.findValue(session, "missing")).isEmpty();
    }
}
