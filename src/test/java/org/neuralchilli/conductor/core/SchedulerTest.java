package org.neuralchilli.conductor.core;

import com.hazelcast.core.HazelcastInstance;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.conductor.agent.TestAgent;
import org.neuralchilli.conductor.config.GroupDefinitionParser;
import org.neuralchilli.conductor.config.TestConductorConfig;
import org.neuralchilli.conductor.config.TestHazelcast;
import org.neuralchilli.conductor.domain.ConfigurationException;
import org.neuralchilli.conductor.domain.ContextInfo;
import org.neuralchilli.conductor.domain.ControlMessage;
import org.neuralchilli.conductor.domain.Dependency;
import org.neuralchilli.conductor.domain.GroupResult;
import org.neuralchilli.conductor.domain.Node;
import org.neuralchilli.conductor.domain.NodeKind;
import org.neuralchilli.conductor.domain.TaskGroupDefinition;
import org.neuralchilli.conductor.domain.TaskInfo;
import org.neuralchilli.conductor.messaging.Channels;
import org.neuralchilli.conductor.messaging.MessageBroker;
import org.neuralchilli.conductor.messaging.MessageCodec;
import org.neuralchilli.conductor.monitoring.SchedulerMetrics;
import org.neuralchilli.conductor.service.GroupDefinitionValidator;
import org.neuralchilli.conductor.store.StateStore;
import org.neuralchilli.conductor.worker.TaskRunner;
import org.neuralchilli.conductor.worker.WorkerPool;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class SchedulerTest {

    private static HazelcastInstance hazelcast;

    private ConductorFixture fixture;
    private TestAgent agent;

    @BeforeAll
    static void setupClass() {
        hazelcast = TestHazelcast.newInstance("scheduler");
    }

    @AfterAll
    static void teardownClass() {
        if (hazelcast != null) {
            hazelcast.shutdown();
        }
    }

    @BeforeEach
    void setup() {
        fixture = new ConductorFixture(hazelcast, TestConductorConfig.defaults());
        agent = new TestAgent("writer", (request, context) -> {
            Map<String, Object> result = new LinkedHashMap<>();
            for (String key : request.resultKeys()) {
                result.put(key, request.message());
            }
            return result;
        });
        fixture.agents.register(agent);
    }

    @AfterEach
    void teardown() {
        fixture.close();
    }

    private static Map<String, Object> taskPayload(String name, String resultKey, List<String> dependencies) {
        return Map.of(
                "name", name,
                "agent_class", "writer",
                "message_template", "Write " + name + " using {" + (dependencies.isEmpty() ? "topic" : dependencies.get(0)) + "}",
                "result_keys", List.of(resultKey),
                "dependencies", dependencies
        );
    }

    @Test
    void shouldIgnoreActionsOtherThanInitialize() {
        // Given: a scheduler whose collaborators must stay untouched
        StateStore store = mock(StateStore.class);
        MessageBroker broker = mock(MessageBroker.class);
        Scheduler scheduler = new Scheduler(store, broker, new MessageCodec(), mock(DependencyRegistry.class),
                mock(SessionContexts.class), mock(TaskRunner.class), mock(WorkerPool.class),
                mock(NodeLifecycle.class), new GroupDefinitionParser(), new GroupDefinitionValidator(),
                new SchedulerMetrics(), TestConductorConfig.defaults());

        // When
        Optional<CompletableFuture<?>> run = scheduler.handle(
                new ControlMessage("msg-1", "pause", Map.of("name", "anything"), Map.of()));

        // Then
        assertThat(run).isEmpty();
        verifyNoInteractions(store, broker);
    }

    @Test
    void shouldSubscribeToControlTopicOnStartup() {
        // Given
        MessageBroker broker = mock(MessageBroker.class);
        TestConductorConfig config = new TestConductorConfig(Duration.ofSeconds(5),
                Duration.ofMillis(500), "scope", "agency_action", true, 1, 1, 2, false);
        Scheduler scheduler = new Scheduler(mock(StateStore.class), broker, new MessageCodec(),
                mock(DependencyRegistry.class), mock(SessionContexts.class), mock(TaskRunner.class),
                mock(WorkerPool.class), mock(NodeLifecycle.class), new GroupDefinitionParser(),
                new GroupDefinitionValidator(), new SchedulerMetrics(), config);

        // When
        scheduler.onStart(null);

        // Then
        verify(broker).subscribe(eq("agency_action"), any());
    }

    @Test
    void shouldRunGroupFromInitializeMessage() {
        // Given
        String sessionId = "session-" + UUID.randomUUID();
        List<Map<String, Object>> finals = new CopyOnWriteArrayList<>();
        fixture.broker.subscribe(Channels.AGENCY_TASK_GROUP_COMPLETED,
                (channel, payload) -> finals.add(fixture.codec.decodeMap(payload)));

        ControlMessage message = new ControlMessage("msg-2", "initialize", Map.of(
                "id", "group-init",
                "name", "initialized",
                "session_id", sessionId,
                "tasks", List.of(taskPayload("draft", "draft_text", List.of()))
        ), Map.of("topic", "queues"));

        // When
        CompletableFuture<?> run = fixture.scheduler.handle(message).orElseThrow();
        GroupResult result = (GroupResult) run.join();

        // Then
        assertThat(result.isCompleted()).isTrue();
        assertThat(result.context()).containsEntry("draft_text", "Write draft using queues");
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> assertThat(finals)
                .anySatisfy(payload -> assertThat(payload).containsEntry("group_id", "group-init")));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldLaunchSessionWithDependenciesAcrossGroups() {
        // Given: group "review" needs a key produced by group "research"
        String sessionId = "session-" + UUID.randomUUID();
        Map<String, Object> research = Map.of(
                "name", "research",
                "tasks", List.of(taskPayload("gather", "facts", List.of())));
        Map<String, Object> review = Map.of(
                "name", "review",
                "tasks", List.of(taskPayload("critique", "verdict", List.of("facts"))));

        ControlMessage message = new ControlMessage("msg-3", "initialize", Map.of(
                "session_id", sessionId,
                "task_groups", List.of(review, research)
        ), Map.of("topic", "caching"));

        List<Map<String, Object>> finals = new CopyOnWriteArrayList<>();
        fixture.broker.subscribe(Channels.AGENCY_TASK_GROUP_COMPLETED,
                (channel, payload) -> finals.add(fixture.codec.decodeMap(payload)));

        // When
        List<GroupResult> results = (List<GroupResult>) fixture.scheduler.handle(message).orElseThrow().join();

        // Then
        assertThat(results).hasSize(2).allMatch(GroupResult::isCompleted);
        assertThat(agent.lastRequest("critique").message()).isEqualTo("Write critique using Write gather using caching");
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> assertThat(finals)
                .anySatisfy(payload -> {
                    assertThat(payload).containsEntry("status", "completed").containsEntry("session_id", sessionId);
                    assertThat((Map<String, Object>) payload.get("context")).containsKeys("facts", "verdict");
                }));
    }

    @Test
    void shouldPublishConfigurationErrorForMalformedControlMessage() {
        // Given
        List<Map<String, Object>> errors = new CopyOnWriteArrayList<>();
        fixture.broker.subscribe(Channels.ERRORS, (channel, payload) -> errors.add(fixture.codec.decodeMap(payload)));

        // When: one payload is not JSON, the other has no tasks
        fixture.scheduler.onControlMessage("agency_action", "{not json");
        fixture.scheduler.onControlMessage("agency_action",
                "{\"action\":\"initialize\",\"object\":{\"name\":\"empty\",\"session_id\":\"s\"}}");

        // Then
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> {
            assertThat(errors).hasSize(2);
            assertThat(errors).allSatisfy(e -> assertThat(e).containsEntry("error_type", "configuration_error"));
        });
    }

    @Test
    void shouldRejectInitializeWithoutSession() {
        ControlMessage message = new ControlMessage("msg-4", "initialize", Map.of(
                "name", "orphan",
                "tasks", List.of(taskPayload("draft", "draft_text", List.of()))
        ), Map.of());

        assertThatThrownBy(() -> fixture.scheduler.handle(message))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("session");
    }

    @Test
    void shouldDeleteSessionKeysOnCleanup() {
        // Given
        String sessionId = "session-" + UUID.randomUUID();
        ControlMessage message = new ControlMessage("msg-5", "initialize", Map.of(
                "name", "to-clean",
                "session_id", sessionId,
                "tasks", List.of(taskPayload("draft", "draft_text", List.of()))
        ), Map.of("topic", "cleanup"));
        fixture.scheduler.handle(message).orElseThrow().join();
        assertThat(fixture.registry.entries(sessionId)).containsKey("draft_text");

        // When
        int deleted = fixture.scheduler.cleanupSession(sessionId);

        // Then
        assertThat(deleted).isGreaterThan(0);
        assertThat(fixture.registry.entries(sessionId)).isEmpty();
        assertThat(fixture.registry.findValue(sessionId, "draft_text")).isEmpty();
    }

    @Test
    void shouldReleaseWaitingNodeSubscriptionsOnCleanup() {
        // Given: a node waiting on a registered producer that has not delivered
        String sessionId = "session-" + UUID.randomUUID();
        fixture.registry.registerGroup(new TaskGroupDefinition("research", null, "research", sessionId,
                List.of(TaskInfo.builder("collect").agentClass("writer").messageTemplate("Collect")
                        .resultKeys("facts").build()),
                ContextInfo.empty()));
        Node node = Node.builder("summarize", NodeKind.STEP)
                .sessionId(sessionId)
                .agent("writer")
                .dependency(Dependency.on("facts"))
                .build();
        CompletableFuture<Node> run = fixture.nodes.run(node);
        assertThat(fixture.nodes.subscribedChannels(sessionId))
                .containsExactly(Channels.resultChannel("task_group_execute", "research", "facts"));

        // When
        fixture.scheduler.cleanupSession(sessionId);

        // Then
        assertThat(fixture.nodes.subscribedChannels(sessionId)).isEmpty();
        assertThat(run).isCompletedExceptionally();
        assertThat(fixture.registry.entries(sessionId)).isEmpty();
    }
}
