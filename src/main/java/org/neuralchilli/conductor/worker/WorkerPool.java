package org.neuralchilli.conductor.worker;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.conductor.config.ConductorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Threads for the scheduler.
 * <p>
 * Tasks run on a fixed pool. Items of an expanded task run on their own fixed pool so a
 * parent waiting for its items never holds the threads they need. Group loops run on a
 * cached pool since each one mostly waits. Periodic re-checks run on a single poll thread.
 */
@ApplicationScoped
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final ConductorConfig config;

    private ThreadPoolExecutor taskExecutor;
    private ThreadPoolExecutor expansionExecutor;
    private ThreadPoolExecutor groupExecutor;
    private ScheduledThreadPoolExecutor pollExecutor;
    private volatile boolean running = false;

    @Inject
    public WorkerPool(ConductorConfig config) {
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        start();
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    public synchronized void start() {
        if (running) {
            log.debug("Worker pool already running");
            return;
        }

        int taskThreads = Math.max(1, config.workerThreads());
        int expansionThreads = Math.max(1, config.expansionThreads());

        taskExecutor = new ThreadPoolExecutor(taskThreads, taskThreads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new NamedThreadFactory("conductor-task"));
        expansionExecutor = new ThreadPoolExecutor(expansionThreads, expansionThreads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new NamedThreadFactory("conductor-expand"));
        groupExecutor = new ThreadPoolExecutor(0, Integer.MAX_VALUE, 60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(), new NamedThreadFactory("conductor-group"));
        pollExecutor = new ScheduledThreadPoolExecutor(1, new NamedThreadFactory("conductor-poll"));
        running = true;

        log.info("Worker pool started: {} task threads, {} expansion threads", taskThreads, expansionThreads);
    }

    /**
     * Run a task on the task pool.
     */
    public CompletableFuture<Void> submitTask(Runnable task) {
        return CompletableFuture.runAsync(task, taskPool());
    }

    public ExecutorService expansionExecutor() {
        ensureRunning();
        return expansionExecutor;
    }

    public ExecutorService groupExecutor() {
        ensureRunning();
        return groupExecutor;
    }

    /**
     * Run {@code action} every {@code interval} on the poll thread until the returned future is cancelled.
     */
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable action, Duration interval) {
        ensureRunning();
        long millis = Math.max(1L, interval.toMillis());
        return pollExecutor.scheduleAtFixedRate(action, millis, millis, TimeUnit.MILLISECONDS);
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Stop all pools, letting in-flight work finish.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.info("Stopping worker pool gracefully...");
        running = false;

        shutdown("poll", pollExecutor);
        shutdown("group", groupExecutor);
        shutdown("task", taskExecutor);
        shutdown("expansion", expansionExecutor);

        log.info("Worker pool stopped");
    }

    public WorkerPoolStats getStats() {
        if (!running) {
            return new WorkerPoolStats(0, 0, 0, 0, false);
        }
        return new WorkerPoolStats(
                taskExecutor.getMaximumPoolSize(),
                taskExecutor.getActiveCount(),
                taskExecutor.getQueue().size(),
                groupExecutor.getActiveCount(),
                true
        );
    }

    private ExecutorService taskPool() {
        ensureRunning();
        return taskExecutor;
    }

    private void ensureRunning() {
        if (!running) {
            start();
        }
    }

    private void shutdown(String name, ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("{} pool did not terminate in 60 seconds, forcing shutdown", name);
                executor.shutdownNow();
                if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                    log.error("{} pool did not terminate after forced shutdown", name);
                }
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static class NamedThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);
        private final String prefix;

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName(prefix + "-" + counter.incrementAndGet());
            t.setDaemon(false); // Keep JVM alive
            return t;
        }
    }

    public record WorkerPoolStats(
            int taskThreads,
            int activeTasks,
            int queuedTasks,
            int activeGroups,
            boolean running
    ) {
        public double utilization() {
            return taskThreads > 0 ? (double) activeTasks / taskThreads : 0.0;
        }
    }
}
