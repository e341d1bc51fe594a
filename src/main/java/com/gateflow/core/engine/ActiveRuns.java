package com.gateflow.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the runs currently executing in this process, keyed by requestId and by
 * pipeline key. At most one run per pipeline key is active at a time.
 */
@Component
public class ActiveRuns {

    private static final Logger log = LoggerFactory.getLogger(ActiveRuns.class);

    private final ConcurrentHashMap<String, RunContext> byRequestId = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RunContext> byPipelineKey = new ConcurrentHashMap<>();

    /**
     * @throws PipelineAlreadyRunningException if a run for the same pipeline key is active
     * @throws IllegalStateException           if another active run already uses the requestId
     */
    public void register(RunContext context) {
        RunContext existing = byPipelineKey.putIfAbsent(context.pipelineKey(), context);
        if (existing != null) {
            throw new PipelineAlreadyRunningException(context.pipelineKey());
        }
        RunContext sameId = byRequestId.putIfAbsent(context.requestId(), context);
        if (sameId != null) {
            byPipelineKey.remove(context.pipelineKey(), context);
            throw new IllegalStateException("Request id " + context.requestId()
                    + " is already used by running pipeline " + sameId.pipelineKey());
        }
        log.debug("Registered run {} for {}", context.requestId(), context.pipelineKey());
    }

    public void unregister(RunContext context) {
        byRequestId.remove(context.requestId(), context);
        byPipelineKey.remove(context.pipelineKey(), context);
    }

    /**
     * @throws IllegalStateException if no run with this id is registered
     */
    public RunContext require(String requestId) {
        RunContext context = byRequestId.get(requestId);
        if (context == null) {
            throw new IllegalStateException("No active run " + requestId);
        }
        return context;
    }

    public Optional<RunContext> byPipelineKey(String pipelineKey) {
        return Optional.ofNullable(byPipelineKey.get(pipelineKey));
    }

    public boolean isRunning(String pipelineKey) {
        return byPipelineKey.containsKey(pipelineKey);
    }

    /**
     * Raises the abort signal of the active run for this key.
     *
     * @return false if no run for the key is active
     */
    public boolean cancel(String pipelineKey, String reason) {
        RunContext context = byPipelineKey.get(pipelineKey);
        if (context == null) {
            return false;
        }
        context.abortSignal().abort(reason);
        log.info("Abort requested for {} ({})", pipelineKey, reason);
        return true;
    }

    public Set<String> runningKeys() {
        return Set.copyOf(byPipelineKey.keySet());
    }
}
