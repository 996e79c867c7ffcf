package org.neuralchilli.conductor.worker;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.conductor.config.TestConductorConfig;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerPoolTest {

    private final WorkerPool pool = new WorkerPool(TestConductorConfig.defaults());

    @AfterEach
    void cleanup() {
        pool.stop();
    }

    @Test
    void shouldStartOnFirstUse() throws Exception {
        assertThat(pool.isRunning()).isFalse();

        pool.submitTask(() -> { }).get(5, TimeUnit.SECONDS);

        assertThat(pool.isRunning()).isTrue();
        assertThat(pool.getStats().taskThreads()).isEqualTo(4);
    }

    @Test
    void shouldRunTasksOnNamedThreads() throws Exception {
        // Given
        Set<String> threads = ConcurrentHashMap.newKeySet();
        CountDownLatch latch = new CountDownLatch(2);

        // When
        pool.submitTask(() -> {
            threads.add(Thread.currentThread().getName());
            latch.countDown();
        });
        pool.expansionExecutor().execute(() -> {
            threads.add(Thread.currentThread().getName());
            latch.countDown();
        });

        // Then
        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(threads).anyMatch(name -> name.startsWith("conductor-task-"));
        assertThat(threads).anyMatch(name -> name.startsWith("conductor-expand-"));
    }

    @Test
    void shouldReportStoppedPool() {
        pool.start();
        pool.start();

        pool.stop();

        assertThat(pool.isRunning()).isFalse();
        assertThat(pool.getStats().running()).isFalse();
        assertThat(pool.getStats().utilization()).isZero();
    }
}
