package com.gateflow.core.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Durable key/value store for pipeline and gate records.
 * <p>
 * Implementations must give atomic replace semantics: a read of a key returns either the
 * previous durable value or the new one, never a partially written record, and writes under
 * different keys never interfere with each other.
 */
public interface StateStore {

    /**
     * Serializes {@code value} and atomically replaces the record stored under {@code key}.
     *
     * @throws StateStoreException if the record could not be made durable
     */
    void write(String key, Object value);

    /**
     * Reads and deserializes the record stored under {@code key}.
     *
     * @return the record, or empty if none exists
     * @throws StateStoreException if the record exists but cannot be read
     */
    <T> Optional<T> read(String key, Class<T> type);

    boolean exists(String key);

    /**
     * Lists stored keys ending with {@code suffix}, sorted alphabetically.
     */
    List<String> listKeys(String suffix);

    void delete(String key);
}
