package com.gateflow.core.nodes;

import com.gateflow.core.engine.ActiveRuns;
import com.gateflow.core.engine.PipelineStateMachine;
import com.gateflow.core.engine.RunContext;
import com.gateflow.core.events.EventBus;
import com.gateflow.core.events.PipelineEvent;
import com.gateflow.core.gate.GateContext;
import com.gateflow.core.gate.GateExecutor;
import com.gateflow.core.healing.ExecutionOutcome;
import com.gateflow.core.healing.HealingLoop;
import com.gateflow.core.logging.MdcContext;
import com.gateflow.core.metrics.GateflowMetrics;
import com.gateflow.core.model.Gate;
import com.gateflow.core.model.GateResult;
import com.gateflow.core.model.HealingReport;
import com.gateflow.core.model.PipelineState;
import com.gateflow.core.state.PipelineGraphState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * LangGraph4j node that runs one gate and records the transition.
 * <p>
 * The abort signal is checked before the gate starts. Gates already completed by an earlier
 * attempt of the same pipeline are skipped. The execution gate runs inside the healing loop.
 */
@Component
public class RunGateNode {

    private static final Logger log = LoggerFactory.getLogger(RunGateNode.class);

    private final ActiveRuns activeRuns;
    private final GateExecutor gateExecutor;
    private final HealingLoop healingLoop;
    private final PipelineStateMachine stateMachine;
    private final GateflowMetrics metrics;
    private final EventBus eventBus;

    public RunGateNode(ActiveRuns activeRuns, GateExecutor gateExecutor, HealingLoop healingLoop,
                       PipelineStateMachine stateMachine, GateflowMetrics metrics, EventBus eventBus) {
        this.activeRuns = activeRuns;
        this.gateExecutor = gateExecutor;
        this.healingLoop = healingLoop;
        this.stateMachine = stateMachine;
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(Gate gate, PipelineGraphState state) {
        RunContext run = activeRuns.require(state.requestId());
        if (run.abortSignal().isAborted()) {
            log.info("Run {} aborted before gate {}", run.requestId(), gate.index());
            eventBus.publish(PipelineEvent.of(PipelineEvent.PIPELINE_ABORTED, run.requestId(),
                    run.pipelineKey(), gate.index(), Map.of("reason", String.valueOf(run.abortSignal().reason()))));
            return Map.of(PipelineGraphState.ABORTED, true);
        }

        PipelineState current = state.pipelineState();
        if (current.isCompleted(gate)) {
            log.info("Gate {} already completed; using its stored result", gate.index());
            return Map.of();
        }

        MdcContext.setGate(gate.index());
        try {
            eventBus.publish(PipelineEvent.of(PipelineEvent.GATE_STARTED, run.requestId(), run.pipelineKey(),
                    gate.index(), Map.of("worker", gate.workerName())));

            GateContext context = run.gateContext();
            GateResult result;
            HealingReport report = null;
            if (gate == Gate.EXECUTION) {
                ExecutionOutcome outcome = healingLoop.execute(context);
                result = outcome.result();
                report = outcome.report();
            } else {
                result = gateExecutor.execute(gate, context);
            }
            metrics.recordGateDuration(gate.index(), gate.workerName(), result.durationMs());
            metrics.recordGateResult(gate.index(), result.status().name());

            Instant now = Instant.now();
            PipelineState next = result.status().allowsProgress()
                    ? current.withGateCompleted(gate, now)
                    : current.withGateFailed(gate, failureReason(gate, result), now);
            next = stateMachine.transition(current, next);

            eventBus.publish(PipelineEvent.of(PipelineEvent.GATE_COMPLETED, run.requestId(), run.pipelineKey(),
                    gate.index(), Map.of(
                            "worker", gate.workerName(),
                            "status", result.status().name(),
                            "score", result.validation().score(),
                            "issues", result.validation().issues())));

            Map<String, Object> updates = new HashMap<>();
            updates.put(PipelineGraphState.PIPELINE_STATE, next);
            if (report != null) {
                updates.put(PipelineGraphState.HEALING_REPORT, report);
            }
            if (!result.status().allowsProgress()) {
                log.warn("Gate {} FAILED; halting pipeline: {}", gate.index(), result.validation().issues());
                updates.put(PipelineGraphState.ISSUES, result.validation().issues());
            }
            return updates;
        } finally {
            MdcContext.clearGate();
        }
    }

    private static String failureReason(Gate gate, GateResult result) {
        var issues = result.validation().issues();
        return "gate " + gate.index() + " (" + gate.workerName() + ") failed"
                + (issues.isEmpty() ? "" : ": " + String.join("; ", issues));
    }
}
