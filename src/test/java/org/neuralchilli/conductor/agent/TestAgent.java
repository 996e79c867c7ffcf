package org.neuralchilli.conductor.agent;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted agent that records its calls and how many ran at once.
 */
public class TestAgent implements AgentExecutor {

    @FunctionalInterface
    public interface Behaviour {
        Map<String, Object> apply(AgentRequest request, Map<String, Object> context) throws Exception;
    }

    private final String name;
    private final Behaviour behaviour;

    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();
    private final List<AgentRequest> requests = new CopyOnWriteArrayList<>();
    private final Map<String, AtomicInteger> callsByTask = new ConcurrentHashMap<>();

    public TestAgent(String name, Behaviour behaviour) {
        this.name = name;
        this.behaviour = behaviour;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Map<String, Object> execute(AgentRequest request, Map<String, Object> context) throws Exception {
        requests.add(request);
        callsByTask.computeIfAbsent(request.taskName(), k -> new AtomicInteger()).incrementAndGet();
        int now = running.incrementAndGet();
        maxRunning.accumulateAndGet(now, Math::max);
        try {
            return behaviour.apply(request, context);
        } finally {
            running.decrementAndGet();
        }
    }

    public List<AgentRequest> requests() {
        return List.copyOf(requests);
    }

    public int calls(String taskName) {
        AtomicInteger calls = callsByTask.get(taskName);
        return calls != null ? calls.get() : 0;
    }

    public int totalCalls() {
        return requests.size();
    }

    public int maxConcurrent() {
        return maxRunning.get();
    }

    public AgentRequest lastRequest(String taskName) {
        AgentRequest last = null;
        for (AgentRequest request : requests) {
            if (request.taskName().equals(taskName)) {
                last = request;
            }
        }
        return last;
    }
}
