package com.gateflow.core.engine;

import com.gateflow.core.model.Gate;
import com.gateflow.core.model.PipelineState;
import com.gateflow.core.model.PipelineStatus;
import com.gateflow.core.persistence.DurableWrites;
import com.gateflow.core.persistence.StateKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Owns writes of the {@link PipelineState} record.
 * <p>
 * Every transition is checked against the progress invariants and written through before
 * the caller moves on. Writing a state that equals the stored one is a no-op.
 */
@Service
public class PipelineStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PipelineStateMachine.class);

    private final DurableWrites writes;

    public PipelineStateMachine(DurableWrites writes) {
        this.writes = writes;
    }

    public Optional<PipelineState> load(String domain, String feature) {
        return writes.store().read(StateKeys.pipeline(domain, feature), PipelineState.class);
    }

    /**
     * Writes the first state of a fresh run, replacing whatever an earlier run left behind.
     */
    public PipelineState start(PipelineState initial) {
        checkInvariants(initial);
        String key = key(initial);
        writes.writeRequired(key, initial);
        log.info("Pipeline {} started", key);
        return initial;
    }

    /**
     * Persists a transition from {@code current} to {@code next}.
     *
     * @return the durable state
     * @throws IllegalStateException if the transition breaks a progress invariant
     */
    public PipelineState transition(PipelineState current, PipelineState next) {
        if (next.sameProgressAs(current)) {
            return current;
        }
        checkTransition(current, next);
        String key = key(next);
        Optional<PipelineState> stored = writes.store().read(key, PipelineState.class);
        if (stored.isPresent() && stored.get().sameProgressAs(next)) {
            log.debug("Pipeline {} already at this state; skipping write", key);
            return stored.get();
        }
        writes.writeRequired(key, next);
        log.debug("Pipeline {} -> {} (currentGate={}, completed={})", key, next.status(),
                next.currentGate(), next.completedGates());
        return next;
    }

    static void checkTransition(PipelineState current, PipelineState next) {
        checkInvariants(next);
        if (current == null) {
            return;
        }
        if (next.currentGate() < current.currentGate()) {
            throw new IllegalStateException("currentGate cannot move back from "
                    + current.currentGate() + " to " + next.currentGate());
        }
        if (!next.completedGates().subList(0, Math.min(current.completedGates().size(), next.completedGates().size()))
                .equals(current.completedGates())) {
            throw new IllegalStateException("completed gates cannot be rewritten: "
                    + current.completedGates() + " -> " + next.completedGates());
        }
        if (current.status() == PipelineStatus.FAILED && next.completedGates().size() > current.completedGates().size()) {
            throw new IllegalStateException("no gate may complete after the pipeline failed");
        }
        if (current.status().isTerminal() && next.status() != current.status()) {
            throw new IllegalStateException("terminal status " + current.status() + " cannot change to " + next.status());
        }
    }

    /**
     * completedGates strictly increasing, within 0..5, each with its required predecessors.
     */
    static void checkInvariants(PipelineState state) {
        List<Integer> completed = state.completedGates();
        Set<Integer> seen = new HashSet<>();
        int previous = -1;
        for (int index : completed) {
            if (index <= previous) {
                throw new IllegalStateException("completed gates must be strictly increasing: " + completed);
            }
            Gate gate = Gate.of(index);
            for (Gate required : gate.requiredPredecessors()) {
                if (!seen.contains(required.index())) {
                    throw new IllegalStateException("gate " + index + " completed without gate " + required.index());
                }
            }
            seen.add(index);
            previous = index;
        }
        if (state.failedGate() != null && seen.stream().anyMatch(g -> g > state.failedGate())) {
            throw new IllegalStateException("gate completed after failed gate " + state.failedGate());
        }
    }

    private static String key(PipelineState state) {
        return StateKeys.pipeline(state.request().domain(), state.request().feature());
    }
}
