package com.gateflow.core.engine;

import com.gateflow.core.audit.AuditRecord;
import com.gateflow.core.audit.QualityScorer;
import com.gateflow.core.events.EventBus;
import com.gateflow.core.events.PipelineEvent;
import com.gateflow.core.gate.GateContractViolation;
import com.gateflow.core.gate.GateExecutor;
import com.gateflow.core.graph.PipelineGraph;
import com.gateflow.core.logging.MdcContext;
import com.gateflow.core.metrics.GateflowMetrics;
import com.gateflow.core.model.Gate;
import com.gateflow.core.model.GateResult;
import com.gateflow.core.model.HealingReport;
import com.gateflow.core.model.PipelineRequest;
import com.gateflow.core.model.PipelineResult;
import com.gateflow.core.model.PipelineState;
import com.gateflow.core.model.QualityMetrics;
import com.gateflow.core.persistence.DurableWrites;
import com.gateflow.core.persistence.StateKeys;
import com.gateflow.core.persistence.StateStoreException;
import com.gateflow.core.state.PipelineGraphState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the pipeline engine.
 * <p>
 * Validates the request, seeds the durable {@link PipelineState}, registers the run's
 * runtime context and invokes the compiled {@link PipelineGraph}. The graph's conditional
 * edges decide the gate order; this class turns the final graph state and the stored gate
 * records into a {@link PipelineResult}.
 */
@Service
public class PipelineCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PipelineCoordinator.class);

    private final PipelineGraph pipelineGraph;
    private final PipelineStateMachine stateMachine;
    private final GateExecutor gateExecutor;
    private final QualityScorer qualityScorer;
    private final DurableWrites writes;
    private final ActiveRuns activeRuns;
    private final EventBus eventBus;
    private final GateflowMetrics metrics;

    public PipelineCoordinator(PipelineGraph pipelineGraph, PipelineStateMachine stateMachine,
                               GateExecutor gateExecutor, QualityScorer qualityScorer, DurableWrites writes,
                               ActiveRuns activeRuns, EventBus eventBus, GateflowMetrics metrics) {
        this.pipelineGraph = pipelineGraph;
        this.stateMachine = stateMachine;
        this.gateExecutor = gateExecutor;
        this.qualityScorer = qualityScorer;
        this.writes = writes;
        this.activeRuns = activeRuns;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public PipelineResult run(PipelineRequest request) {
        return run(request, AbortSignal.none());
    }

    /**
     * Runs a fresh pipeline for the request.
     *
     * @throws InputValidationException        before any state is written, if the request is invalid
     * @throws PipelineAlreadyRunningException if the same (domain, feature) is running in this process
     * @throws StateStoreException             if a pipeline or gate record cannot be made durable
     */
    public PipelineResult run(PipelineRequest request, AbortSignal abortSignal) {
        RequestValidator.validate(request);

        PipelineRequest accepted = request.requestId() == null || request.requestId().isBlank()
                ? request.withRequestId(RequestIds.next())
                : request;
        String pipelineKey = StateKeys.pipeline(accepted.domain(), accepted.feature());
        var context = new RunContext(accepted, pipelineKey, abortSignal);
        activeRuns.register(context);
        MdcContext.setPipeline(accepted.requestId(), pipelineKey);
        try {
            log.info("Starting pipeline {} for {} ({} acceptance criteria)", accepted.requestId(), pipelineKey,
                    accepted.acceptanceCriteria().size());
            clearPreviousRun(accepted);
            PipelineState initial = stateMachine.start(PipelineState.started(accepted, Instant.now()));
            eventBus.publish(PipelineEvent.of(PipelineEvent.PIPELINE_STARTED, accepted.requestId(), pipelineKey,
                    null, Map.of("url", accepted.url())));
            return execute(context, initial);
        } finally {
            activeRuns.unregister(context);
            MdcContext.clear();
        }
    }

    public PipelineResult resume(String domain, String feature) {
        return resume(domain, feature, AbortSignal.none());
    }

    /**
     * Continues an interrupted pipeline from its last durable state. Completed gates are
     * skipped, the stored data preparation decision is reused. A pipeline that already
     * reached a terminal status is reported as stored.
     *
     * @throws PipelineNotFoundException if no pipeline record exists
     */
    public PipelineResult resume(String domain, String feature, AbortSignal abortSignal) {
        String pipelineKey = StateKeys.pipeline(domain, feature);
        PipelineState stored = stateMachine.load(domain, feature)
                .orElseThrow(() -> new PipelineNotFoundException(pipelineKey));
        if (stored.status().isTerminal()) {
            log.info("Pipeline {} already finished with {}; nothing to resume", pipelineKey, stored.status());
            return report(stored, 0, false);
        }

        PipelineRequest request = stored.request();
        var context = new RunContext(request, pipelineKey, abortSignal);
        activeRuns.register(context);
        MdcContext.setPipeline(request.requestId(), pipelineKey);
        try {
            log.info("Resuming pipeline {} at gate {} (completed {})", request.requestId(),
                    stored.currentGate(), stored.completedGates());
            eventBus.publish(PipelineEvent.of(PipelineEvent.PIPELINE_RESUMED, request.requestId(), pipelineKey,
                    null, Map.of("completedGates", stored.completedGates())));
            return execute(context, stored);
        } finally {
            activeRuns.unregister(context);
            MdcContext.clear();
        }
    }

    /**
     * Result view of the stored records of a pipeline, without running anything.
     */
    public Optional<PipelineResult> status(String domain, String feature) {
        return stateMachine.load(domain, feature).map(state -> report(state, 0, false));
    }

    /**
     * Stored pipeline states, ordered by key.
     */
    public List<PipelineState> history() {
        List<PipelineState> states = new ArrayList<>();
        for (String key : writes.store().listKeys(StateKeys.PIPELINE_SUFFIX)) {
            writes.store().read(key, PipelineState.class).ifPresent(states::add);
        }
        return states;
    }

    /**
     * Raises the abort signal of the active run for (domain, feature). The run stops before
     * its next gate; the last durable state stays resumable.
     *
     * @return false if no run for the key is active in this process
     */
    public boolean cancel(String domain, String feature) {
        return activeRuns.cancel(StateKeys.pipeline(domain, feature), "cancel requested");
    }

    public boolean isRunning(String domain, String feature) {
        return activeRuns.isRunning(StateKeys.pipeline(domain, feature));
    }

    private PipelineResult execute(RunContext context, PipelineState initial) {
        long start = System.currentTimeMillis();
        var initialState = new HashMap<String, Object>();
        initialState.put(PipelineGraphState.REQUEST_ID, context.requestId());
        initialState.put(PipelineGraphState.PIPELINE_KEY, context.pipelineKey());
        initialState.put(PipelineGraphState.PIPELINE_STATE, initial);

        var config = RunnableConfig.builder()
                .threadId(context.requestId())
                .build();

        PipelineGraphState finalState;
        try {
            finalState = pipelineGraph.getCompiledGraph()
                    .invoke(Map.copyOf(initialState), config)
                    .orElseThrow(() -> new IllegalStateException(
                            "Graph execution returned empty state for " + context.requestId()));
        } catch (RuntimeException e) {
            throw unwrap(e);
        }

        long elapsed = System.currentTimeMillis() - start;
        PipelineResult result = buildResult(finalState, elapsed);
        if (result.aborted()) {
            log.info("Pipeline {} aborted after {} ms at gate {}", context.requestId(), elapsed,
                    finalState.pipelineState().currentGate());
        } else {
            log.info("Pipeline {} finished {} in {} ms", context.requestId(), result.status(), elapsed);
            metrics.recordPipelineResult(result.status().name());
        }
        metrics.recordPipelineDuration(elapsed);
        return result;
    }

    private PipelineResult buildResult(PipelineGraphState graphState, long elapsed) {
        PipelineState state = graphState.pipelineState();
        PipelineRequest request = state.request();
        Map<Gate, GateResult> results = gateExecutor.loadResults(request.domain(), request.feature());

        QualityMetrics qualityMetrics = graphState.qualityMetrics()
                .orElseGet(() -> qualityScorer.metrics(state, results));
        HealingReport healing = graphState.healingReport()
                .orElseGet(() -> loadHealing(request));

        List<String> issues = state.failedGate() != null
                ? failedGateIssues(state, results)
                : graphState.issues();

        return new PipelineResult(state.status(), request.requestId(), graphState.pipelineKey(), elapsed,
                QualityScorer.summaries(results), QualityScorer.deliverables(results), qualityMetrics, healing,
                graphState.auditTrail(), state.failedGate(), issues, graphState.aborted());
    }

    private PipelineResult report(PipelineState state, long elapsed, boolean aborted) {
        PipelineRequest request = state.request();
        Map<Gate, GateResult> results = gateExecutor.loadResults(request.domain(), request.feature());
        String auditKey = StateKeys.audit(request.domain(), request.feature());
        Optional<AuditRecord> audit = writes.store().read(auditKey, AuditRecord.class);

        QualityMetrics qualityMetrics = audit.map(AuditRecord::qualityMetrics)
                .orElseGet(() -> qualityScorer.metrics(state, results));
        List<String> issues;
        if (state.failedGate() != null) {
            issues = failedGateIssues(state, results);
        } else {
            issues = audit.map(AuditRecord::issues).orElse(List.of());
        }
        return new PipelineResult(state.status(), request.requestId(),
                StateKeys.pipeline(request.domain(), request.feature()), elapsed,
                QualityScorer.summaries(results), QualityScorer.deliverables(results), qualityMetrics,
                loadHealing(request), audit.isPresent() ? auditKey : "", state.failedGate(), issues, aborted);
    }

    private List<String> failedGateIssues(PipelineState state, Map<Gate, GateResult> results) {
        GateResult failed = results.get(Gate.of(state.failedGate()));
        if (failed != null && !failed.validation().issues().isEmpty()) {
            return failed.validation().issues();
        }
        return state.failureReason() != null ? List.of(state.failureReason()) : List.of();
    }

    private HealingReport loadHealing(PipelineRequest request) {
        try {
            return writes.store().read(StateKeys.healing(request.domain(), request.feature()), HealingReport.class)
                    .orElse(HealingReport.empty());
        } catch (StateStoreException e) {
            log.warn("Healing report unreadable; reporting none: {}", e.getMessage());
            return HealingReport.empty();
        }
    }

    /**
     * Removes gate, healing and audit records a previous run of the same feature left behind,
     * so a fresh run never consumes stale upstream output. Learnings are kept.
     */
    private void clearPreviousRun(PipelineRequest request) {
        var store = writes.store();
        for (Gate gate : Gate.values()) {
            store.delete(StateKeys.gateOutput(request.domain(), request.feature(), gate));
        }
        store.delete(StateKeys.healing(request.domain(), request.feature()));
        store.delete(StateKeys.audit(request.domain(), request.feature()));
    }

    /**
     * Node failures reach us wrapped by the graph runtime. Domain exceptions are rethrown as
     * themselves so callers can tell a persistence fault from a sequencing bug.
     */
    static RuntimeException unwrap(RuntimeException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof StateStoreException
                    || current instanceof GateContractViolation
                    || current instanceof IllegalStateException && current != e) {
                return (RuntimeException) current;
            }
            current = current.getCause();
        }
        return e;
    }
}
