package org.neuralchilli.conductor.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeTest {

    @Test
    void shouldRecordMonotonicStatusHistory() {
        // Given
        Node node = Node.builder("plan", NodeKind.STEP).sessionId("s1").build();

        // When
        node.transitionTo(NodeStatus.PRE_INITIALIZING);
        node.transitionTo(NodeStatus.INITIALIZED);
        node.transitionTo(NodeStatus.READY);
        node.transitionTo(NodeStatus.COMPLETED);

        // Then
        List<NodeStatus> history = node.statusHistory();
        assertThat(history).containsExactly(NodeStatus.CREATED, NodeStatus.PRE_INITIALIZING,
                NodeStatus.INITIALIZED, NodeStatus.READY, NodeStatus.COMPLETED);
        for (int i = 1; i < history.size(); i++) {
            assertThat(history.get(i).ordinal()).isGreaterThan(history.get(i - 1).ordinal());
        }
    }

    @Test
    void shouldRejectRegression() {
        Node node = Node.builder("plan", NodeKind.STEP).build();
        node.transitionTo(NodeStatus.EXECUTING);

        assertThatThrownBy(() -> node.transitionTo(NodeStatus.READY))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("EXECUTING");
        assertThat(node.status()).isEqualTo(NodeStatus.EXECUTING);
    }

    @Test
    void shouldIgnoreTransitionToCurrentStatus() {
        Node node = Node.builder("plan", NodeKind.STEP).build();
        node.transitionTo(NodeStatus.READY);

        assertThat(node.transitionTo(NodeStatus.READY)).isNull();
        assertThat(node.statusHistory()).hasSize(2);
    }

    @Test
    void shouldFailFromAnyNonTerminalStatusOnlyOnce() {
        Node node = Node.builder("plan", NodeKind.STEP).build();
        node.transitionTo(NodeStatus.ASSIGNED);

        assertThat(node.fail("boom")).isEqualTo(NodeStatus.ASSIGNED);
        assertThat(node.fail("again")).isNull();
        assertThat(node.status()).isEqualTo(NodeStatus.FAILED);
        assertThat(node.error()).isEqualTo("boom");
        assertThatThrownBy(() -> node.transitionTo(NodeStatus.COMPLETED))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldOnlyBlockOnRequiredDependencies() {
        // Given
        Dependency required = Dependency.on("facts");
        Dependency optional = Dependency.optional("extras");
        Node node = Node.builder("review", NodeKind.STEP)
                .dependency(required)
                .dependency(optional)
                .build();
        assertThat(node.dependenciesMet()).isFalse();

        // When
        required.markMet("x");

        // Then
        assertThat(node.dependenciesMet()).isTrue();
        assertThat(node.unmetDependencies()).containsExactly(optional);
    }

    @Test
    void shouldMarkDependencyMetExactlyOnce() {
        Dependency dependency = Dependency.on("facts", "items.0");

        assertThat(dependency.markMet("first")).isTrue();
        assertThat(dependency.markMet("second")).isFalse();
        assertThat(dependency.output()).isEqualTo("first");
        assertThat(dependency.propertyName()).isEqualTo("facts");
        assertThat(dependency.propertyPath()).isEqualTo("items.0");
    }

    @Test
    void shouldGiveChildrenParentAndSession() {
        Node model = Node.builder("pipeline", NodeKind.MODEL)
                .sessionId("s-42")
                .child(Node.builder("extract", NodeKind.STEP))
                .child(Node.builder("load", NodeKind.STEP))
                .build();

        assertThat(model.children()).extracting(Node::name).containsExactly("extract", "load");
        assertThat(model.children()).allSatisfy(child -> {
            assertThat(child.parentId()).isEqualTo(model.id());
            assertThat(child.sessionId()).isEqualTo("s-42");
        });
    }

    @Test
    void shouldClaimExecutionOnce() {
        Node node = Node.builder("plan", NodeKind.STEP).build();

        assertThat(node.claimExecution()).isTrue();
        assertThat(node.claimExecution()).isFalse();
    }

    @Test
    void shouldRenderWirePayload() {
        Node node = Node.builder("plan", NodeKind.GOAL)
                .contextInfo(ContextInfo.withContext(Map.of("topic", "x")))
                .build();
        node.transitionTo(NodeStatus.PRE_INITIALIZING);

        Map<String, Object> payload = node.toPayload();

        assertThat(payload).containsEntry("status", "pre-initializing")
                .containsEntry("kind", "goal")
                .containsEntry("name", "plan");
    }
}
