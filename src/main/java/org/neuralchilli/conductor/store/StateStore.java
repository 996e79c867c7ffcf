package org.neuralchilli.conductor.store;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shared key/value store used for durable intermediate state and result lookups.
 * Implementations must make single-field operations atomic.
 */
public interface StateStore {

    Optional<String> get(String key);

    void set(String key, String value);

    /**
     * Whole hash stored at {@code key}; empty when absent.
     */
    Map<String, String> getHash(String key);

    void putHash(String key, Map<String, String> fields);

    Optional<String> getField(String key, String field);

    void setField(String key, String field, String value);

    /**
     * Set a hash field only if it has no value yet.
     *
     * @return true if the value was written
     */
    boolean setFieldIfAbsent(String key, String field, String value);

    boolean addMember(String key, String member);

    boolean removeMember(String key, String member);

    boolean isMember(String key, String member);

    Set<String> members(String key);

    /**
     * Delete every value, hash and set whose key matches a glob pattern ({@code *} and {@code ?}).
     * Best-effort; used for cleanup only.
     *
     * @return number of keys deleted
     */
    int deleteByPattern(String pattern);
}
