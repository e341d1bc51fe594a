package com.gateflow.core.nodes;

import com.gateflow.core.audit.AuditRecord;
import com.gateflow.core.audit.LearningsRecord;
import com.gateflow.core.audit.QualityScorer;
import com.gateflow.core.engine.PipelineStateMachine;
import com.gateflow.core.events.EventBus;
import com.gateflow.core.events.PipelineEvent;
import com.gateflow.core.gate.GateExecutor;
import com.gateflow.core.metrics.GateflowMetrics;
import com.gateflow.core.model.Gate;
import com.gateflow.core.model.GateResult;
import com.gateflow.core.model.PipelineRequest;
import com.gateflow.core.model.PipelineState;
import com.gateflow.core.model.PipelineStatus;
import com.gateflow.core.persistence.DurableWrites;
import com.gateflow.core.persistence.StateKeys;
import com.gateflow.core.state.PipelineGraphState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * LangGraph4j node that closes a run: recomputes the quality metrics from every stored gate
 * result, checks the deliverables and assigns the terminal status.
 * <p>
 * The audit trail and learnings records are auxiliary; failing to write them is logged and
 * does not change the outcome. The terminal pipeline state is a required write.
 */
@Component
public class FinalAuditNode {

    private static final Logger log = LoggerFactory.getLogger(FinalAuditNode.class);

    private final GateExecutor gateExecutor;
    private final QualityScorer qualityScorer;
    private final PipelineStateMachine stateMachine;
    private final DurableWrites writes;
    private final GateflowMetrics metrics;
    private final EventBus eventBus;

    public FinalAuditNode(GateExecutor gateExecutor, QualityScorer qualityScorer, PipelineStateMachine stateMachine,
                          DurableWrites writes, GateflowMetrics metrics, EventBus eventBus) {
        this.gateExecutor = gateExecutor;
        this.qualityScorer = qualityScorer;
        this.stateMachine = stateMachine;
        this.writes = writes;
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(PipelineGraphState state) {
        PipelineState current = state.pipelineState();
        PipelineRequest request = current.request();
        Map<Gate, GateResult> results = gateExecutor.loadResults(request.domain(), request.feature());

        AuditRecord audit = qualityScorer.audit(current, results, state.pipelineKey());
        log.info("Final audit: {} (overall score {}, coverage {}, locators {}, compiles {}, pass rate {})",
                audit.status(), audit.qualityMetrics().overallScore(), audit.qualityMetrics().coverage(),
                audit.qualityMetrics().locatorConfidence(), audit.qualityMetrics().compiles(),
                audit.qualityMetrics().passRate());
        metrics.recordOverallScore(audit.qualityMetrics().overallScore());

        String auditKey = StateKeys.audit(request.domain(), request.feature());
        boolean auditWritten = writes.writeAuxiliary(auditKey, audit);
        if (!auditWritten) {
            metrics.incrementAuxiliaryWriteFailures("audit");
        }
        writeLearnings(request, results.get(Gate.LEARNING_CAPTURE));

        String reason = audit.status() == PipelineStatus.FAILED ? String.join("; ", audit.issues()) : null;
        PipelineState next = stateMachine.transition(current,
                current.withStatus(audit.status(), reason, Instant.now()));

        eventBus.publish(PipelineEvent.of(PipelineEvent.PIPELINE_COMPLETED, request.requestId(),
                state.pipelineKey(), null, Map.of(
                        "status", audit.status().name(),
                        "overallScore", audit.qualityMetrics().overallScore())));

        Map<String, Object> updates = new HashMap<>();
        updates.put(PipelineGraphState.PIPELINE_STATE, next);
        updates.put(PipelineGraphState.QUALITY_METRICS, audit.qualityMetrics());
        updates.put(PipelineGraphState.AUDIT_TRAIL, auditWritten ? auditKey : "");
        if (!audit.issues().isEmpty()) {
            updates.put(PipelineGraphState.ISSUES, audit.issues());
        }
        return updates;
    }

    private void writeLearnings(PipelineRequest request, GateResult learningGate) {
        if (learningGate == null || !learningGate.hasOutput()) {
            return;
        }
        var output = learningGate.output();
        var record = new LearningsRecord(request.requestId(), request.domain(), request.feature(),
                output.get("learnings"), output.path("learningFile").asText(null), Instant.now());
        if (!writes.writeAuxiliary(StateKeys.learnings(request.domain(), request.feature()), record)) {
            metrics.incrementAuxiliaryWriteFailures("learnings");
        }
    }
}
