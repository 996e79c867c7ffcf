package org.neuralchilli.conductor.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.conductor.messaging.Channels;
import org.neuralchilli.conductor.messaging.MessageCodec;
import org.neuralchilli.conductor.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Context snapshots shared between the groups of one session.
 * Reads are opportunistic: store failures are logged and yield nothing.
 */
@ApplicationScoped
public class SessionContexts {

    private static final Logger log = LoggerFactory.getLogger(SessionContexts.class);

    private final StateStore store;
    private final MessageCodec codec;

    @Inject
    public SessionContexts(StateStore store, MessageCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    public void storeContext(String sessionId, String groupId, Map<String, Object> serializedContext) {
        store.setField(Channels.sessionGroupContexts(sessionId), groupId, codec.encode(serializedContext));
    }

    public void storePartialResult(String sessionId, String groupId, Map<String, Object> payload) {
        store.setField(Channels.sessionPartialResults(sessionId), groupId, codec.encode(payload));
    }

    /**
     * Deep merge of every stored group context of the session except {@code excludeGroupId}'s.
     */
    public Map<String, Object> mergedContext(String sessionId, String excludeGroupId) {
        Map<String, Object> merged = new LinkedHashMap<>();
        Map<String, String> snapshots;
        try {
            snapshots = store.getHash(Channels.sessionGroupContexts(sessionId));
        } catch (RuntimeException e) {
            log.warn("Could not read group contexts of session {}: {}", sessionId, e.getMessage());
            return merged;
        }

        snapshots.forEach((groupId, json) -> {
            if (groupId.equals(excludeGroupId)) {
                return;
            }
            try {
                ContextMerger.deepMerge(merged, codec.decodeMap(json));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping corrupt context of group {} in session {}", groupId, sessionId, e);
            }
        });
        return merged;
    }

    public Map<String, Object> partialResults(String sessionId) {
        Map<String, Object> results = new LinkedHashMap<>();
        store.getHash(Channels.sessionPartialResults(sessionId))
                .forEach((groupId, json) -> results.put(groupId, codec.decode(json)));
        return results;
    }
}
