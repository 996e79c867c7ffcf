package org.neuralchilli.conductor.messaging;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SubscriptionTrackerTest {

    private MessageBroker broker;
    private MessageHandler handler;
    private SubscriptionTracker tracker;

    @BeforeEach
    void setup() {
        broker = mock(MessageBroker.class);
        handler = (channel, payload) -> { };
        when(broker.subscribe(anyString(), any(MessageHandler.class)))
                .thenAnswer(inv -> new Subscription(inv.getArgument(0), "sub-" + inv.getArgument(0)));
        tracker = new SubscriptionTracker(broker, handler);
    }

    @Test
    void shouldSubscribeOncePerChannel() {
        // When
        boolean first = tracker.acquire("scope:g1:facts", "t1");
        boolean second = tracker.acquire("scope:g1:facts", "t2");

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        verify(broker, times(1)).subscribe(eq("scope:g1:facts"), any(MessageHandler.class));
        assertThat(tracker.waiters("scope:g1:facts")).containsExactlyInAnyOrder("t1", "t2");
    }

    @Test
    void shouldUnsubscribeWhenLastWaiterReleases() {
        // Given
        tracker.acquire("scope:g1:facts", "t1");
        tracker.acquire("scope:g1:facts", "t2");
        tracker.acquire("scope:g1:draft", "t1");

        // When
        tracker.release("t1");

        // Then
        verify(broker).unsubscribe(new Subscription("scope:g1:draft", "sub-scope:g1:draft"));
        verify(broker, never()).unsubscribe(new Subscription("scope:g1:facts", "sub-scope:g1:facts"));
        assertThat(tracker.channels()).containsExactly("scope:g1:facts");

        tracker.release("t2");
        assertThat(tracker.isSubscribed("scope:g1:facts")).isFalse();
    }

    @Test
    void shouldKeepGoingWhenUnsubscribeFails() {
        tracker.acquire("scope:g1:facts", "t1");
        doThrow(new IllegalStateException("gone")).when(broker).unsubscribe(any(Subscription.class));

        tracker.release("t1");

        assertThat(tracker.channels()).isEmpty();
    }

    @Test
    void shouldRefuseAcquireAfterClose() {
        tracker.acquire("scope:g1:facts", "t1");

        tracker.close();

        verify(broker).unsubscribe(any(Subscription.class));
        assertThat(tracker.channels()).isEmpty();
        assertThatThrownBy(() -> tracker.acquire("scope:g1:facts", "t1"))
                .isInstanceOf(IllegalStateException.class);
    }
}
