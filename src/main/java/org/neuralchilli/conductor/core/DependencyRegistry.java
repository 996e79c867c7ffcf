package org.neuralchilli.conductor.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.conductor.domain.DependencyException;
import org.neuralchilli.conductor.domain.RegistryEntry;
import org.neuralchilli.conductor.domain.TaskGroupDefinition;
import org.neuralchilli.conductor.domain.TaskInfo;
import org.neuralchilli.conductor.messaging.Channels;
import org.neuralchilli.conductor.messaging.MessageCodec;
import org.neuralchilli.conductor.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Session-scoped map from result key to the group and task that produce it.
 * The first registration of a key wins; entries are never removed except by session cleanup.
 * Also keeps the last published value of each key as a lookup side-channel.
 */
@ApplicationScoped
public class DependencyRegistry {

    private static final Logger log = LoggerFactory.getLogger(DependencyRegistry.class);

    private final StateStore store;
    private final MessageCodec codec;

    @Inject
    public DependencyRegistry(StateStore store, MessageCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    /**
     * Register every result key of every task in the group.
     *
     * @return number of keys newly registered by this call
     */
    public int registerGroup(TaskGroupDefinition group) {
        String hashKey = Channels.sessionResultKeys(group.sessionId());
        Instant now = Instant.now();
        int registered = 0;

        for (TaskInfo task : group.tasks()) {
            for (String resultKey : task.allResultKeys()) {
                RegistryEntry entry = new RegistryEntry(
                        group.id(), group.name(), task.name(), task.allDependencies(), now);
                if (store.setFieldIfAbsent(hashKey, resultKey, codec.encode(entry.toPayload()))) {
                    registered++;
                    log.debug("Registered result key '{}' -> group {} task {}", resultKey, group.id(), task.name());
                } else {
                    log.debug("Result key '{}' already registered in session {}, keeping first mapping",
                            resultKey, group.sessionId());
                }
            }
        }

        log.info("Registered {} result keys for group '{}' in session {}", registered, group.name(), group.sessionId());
        return registered;
    }

    /**
     * Find the producer of a result key.
     *
     * @throws DependencyException if the store cannot be read or holds a corrupt entry
     */
    public Optional<RegistryEntry> lookup(String sessionId, String resultKey) {
        Optional<String> raw;
        try {
            raw = store.getField(Channels.sessionResultKeys(sessionId), resultKey);
        } catch (RuntimeException e) {
            throw new DependencyException("Registry lookup failed for '" + resultKey + "'", e);
        }
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(RegistryEntry.fromPayload(codec.decodeMap(raw.get())));
        } catch (RuntimeException e) {
            throw new DependencyException("Corrupt registry entry for '" + resultKey + "'", e);
        }
    }

    /**
     * Task group producing {@code resultKey}, if any.
     */
    public Optional<String> groupIdFor(String sessionId, String resultKey) {
        return lookup(sessionId, resultKey).map(RegistryEntry::taskGroupId);
    }

    /**
     * All entries of a session. Corrupt entries are skipped.
     */
    public Map<String, RegistryEntry> entries(String sessionId) {
        Map<String, RegistryEntry> entries = new LinkedHashMap<>();
        store.getHash(Channels.sessionResultKeys(sessionId)).forEach((resultKey, json) -> {
            try {
                entries.put(resultKey, RegistryEntry.fromPayload(codec.decodeMap(json)));
            } catch (RuntimeException e) {
                log.warn("Skipping corrupt registry entry '{}' in session {}", resultKey, sessionId, e);
            }
        });
        return entries;
    }

    /**
     * Remember the latest value published for a result key.
     */
    public void recordValue(String sessionId, String resultKey, Object value) {
        store.setField(Channels.sessionResultValues(sessionId), resultKey, codec.encode(value));
    }

    /**
     * Value already published for a result key, if any.
     *
     * @throws DependencyException if the store cannot be read
     */
    public Optional<Object> findValue(String sessionId, String resultKey) {
        try {
            return store.getField(Channels.sessionResultValues(sessionId), resultKey)
                    .map(codec::decode);
        } catch (RuntimeException e) {
            throw new DependencyException("Result value lookup failed for '" + resultKey + "'", e);
        }
    }
}
