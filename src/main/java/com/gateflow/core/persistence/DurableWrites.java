package com.gateflow.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write policy on top of a {@link StateStore}: every write is retried once.
 * <p>
 * Pipeline and gate records are required, so a second failure propagates. Audit, learning
 * and healing records are auxiliary; a second failure is logged and the run continues.
 */
public class DurableWrites {

    private static final Logger log = LoggerFactory.getLogger(DurableWrites.class);

    private final StateStore store;

    public DurableWrites(StateStore store) {
        this.store = store;
    }

    public StateStore store() {
        return store;
    }

    /**
     * Writes a record that forward progress depends on.
     *
     * @throws StateStoreException if the retry fails as well
     */
    public void writeRequired(String key, Object value) {
        try {
            store.write(key, value);
        } catch (StateStoreException first) {
            log.warn("Write of {} failed, retrying once: {}", key, first.getMessage());
            try {
                store.write(key, value);
            } catch (StateStoreException second) {
                // A store may rethrow the same instance; self-suppression is illegal
                if (second != first) {
                    second.addSuppressed(first);
                }
                throw second;
            }
        }
    }

    /**
     * Writes a record that does not gate forward progress.
     *
     * @return true if the record was written
     */
    public boolean writeAuxiliary(String key, Object value) {
        try {
            writeRequired(key, value);
            return true;
        } catch (StateStoreException e) {
            log.error("Auxiliary record {} could not be written; continuing without it", key, e);
            return false;
        }
    }
}
