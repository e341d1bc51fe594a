package com.gateflow.core.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one run. Checked between gates, never inside one.
 */
public class AbortSignal {

    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private volatile String reason;

    public void abort(String reason) {
        if (aborted.compareAndSet(false, true)) {
            this.reason = reason;
        }
    }

    public boolean isAborted() {
        return aborted.get();
    }

    public String reason() {
        return reason;
    }

    /** A signal nobody will ever raise. */
    public static AbortSignal none() {
        return new AbortSignal();
    }
}
