package org.neuralchilli.conductor.store;

import com.hazelcast.collection.ISet;
import com.hazelcast.core.DistributedObject;
import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * State store on Hazelcast.
 * Hashes map to one IMap per key, sets to one ISet per key, and plain values share
 * a single IMap.
 */
@ApplicationScoped
public class HazelcastStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(HazelcastStateStore.class);

    static final String VALUES_MAP = "conductor-values";
    static final String HASH_PREFIX = "hash:";
    static final String SET_PREFIX = "set:";

    private final HazelcastInstance hazelcast;

    @Inject
    public HazelcastStateStore(HazelcastInstance hazelcast) {
        this.hazelcast = hazelcast;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values().get(key));
    }

    @Override
    public void set(String key, String value) {
        values().set(key, value);
    }

    @Override
    public Map<String, String> getHash(String key) {
        return new HashMap<>(hash(key));
    }

    @Override
    public void putHash(String key, Map<String, String> fields) {
        hash(key).putAll(fields);
    }

    @Override
    public Optional<String> getField(String key, String field) {
        return Optional.ofNullable(hash(key).get(field));
    }

    @Override
    public void setField(String key, String field, String value) {
        hash(key).set(field, value);
    }

    @Override
    public boolean setFieldIfAbsent(String key, String field, String value) {
        return hash(key).putIfAbsent(field, value) == null;
    }

    @Override
    public boolean addMember(String key, String member) {
        return set(key).add(member);
    }

    @Override
    public boolean removeMember(String key, String member) {
        return set(key).remove(member);
    }

    @Override
    public boolean isMember(String key, String member) {
        return set(key).contains(member);
    }

    @Override
    public Set<String> members(String key) {
        return new HashSet<>(set(key));
    }

    @Override
    public int deleteByPattern(String pattern) {
        Pattern regex = globToRegex(pattern);
        int deleted = 0;

        for (DistributedObject object : hazelcast.getDistributedObjects()) {
            String logicalKey = logicalKey(object.getName());
            if (logicalKey != null && regex.matcher(logicalKey).matches()) {
                try {
                    object.destroy();
                    deleted++;
                } catch (RuntimeException e) {
                    log.warn("Failed to delete '{}' during cleanup", object.getName(), e);
                }
            }
        }

        IMap<String, String> values = values();
        for (String key : values.keySet()) {
            if (regex.matcher(key).matches() && values.remove(key) != null) {
                deleted++;
            }
        }

        log.debug("Deleted {} keys matching '{}'", deleted, pattern);
        return deleted;
    }

    private IMap<String, String> values() {
        return hazelcast.getMap(VALUES_MAP);
    }

    private IMap<String, String> hash(String key) {
        return hazelcast.getMap(HASH_PREFIX + key);
    }

    private ISet<String> set(String key) {
        return hazelcast.getSet(SET_PREFIX + key);
    }

    private static String logicalKey(String objectName) {
        if (objectName.startsWith(HASH_PREFIX)) {
            return objectName.substring(HASH_PREFIX.length());
        }
        if (objectName.startsWith(SET_PREFIX)) {
            return objectName.substring(SET_PREFIX.length());
        }
        return null;
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }
}
