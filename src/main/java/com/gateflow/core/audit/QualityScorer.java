package com.gateflow.core.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.gateflow.core.GateflowProperties;
import com.gateflow.core.model.Gate;
import com.gateflow.core.model.GateResult;
import com.gateflow.core.model.GateStatus;
import com.gateflow.core.model.GateSummary;
import com.gateflow.core.model.PipelineState;
import com.gateflow.core.model.PipelineStatus;
import com.gateflow.core.model.QualityMetrics;
import com.gateflow.core.validation.GateProfiles;
import com.gateflow.core.validation.UpstreamArtifacts;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives {@link QualityMetrics} from the gate results and assigns the terminal status.
 * <p>
 * {@code overallScore = round(0.25·coverage + 0.25·locatorConfidence + 0.25·(compiles ? 100 : 0)
 * + 0.25·passRate)}. The status is FAILED unless every required gate completed and every
 * required deliverable is present; past that precondition the pass and partial thresholds
 * decide.
 */
@Service
public class QualityScorer {

    private static final double WEIGHT = 0.25;

    private final GateflowProperties properties;

    public QualityScorer(GateflowProperties properties) {
        this.properties = properties;
    }

    /**
     * Computes the metrics from whatever results exist. Missing gates contribute zero.
     */
    public QualityMetrics metrics(PipelineState state, Map<Gate, GateResult> results) {
        double coverage = output(results, Gate.TEST_CASE_DESIGN)
                .map(o -> GateProfiles.coverage(o, UpstreamArtifacts.of(state.request())))
                .orElse(0.0);
        double confidence = output(results, Gate.ELEMENT_MAPPING)
                .map(GateProfiles::locatorConfidence)
                .orElse(0.0);
        GateResult generation = results.get(Gate.CODE_GENERATION);
        boolean compiles = generation != null && generation.hasOutput()
                && generation.status() != GateStatus.FAILED
                && generation.output().path("compilationErrors").asInt(1) == 0;
        double passRate = output(results, Gate.EXECUTION)
                .map(GateProfiles::passRate)
                .orElse(0.0);

        int overall = (int) Math.round(WEIGHT * coverage + WEIGHT * confidence
                + WEIGHT * (compiles ? 100 : 0) + WEIGHT * passRate);
        return new QualityMetrics((int) Math.round(coverage), (int) Math.round(confidence), compiles,
                (int) Math.round(passRate), overall);
    }

    public AuditRecord audit(PipelineState state, Map<Gate, GateResult> results, String pipelineKey) {
        QualityMetrics metrics = metrics(state, results);
        boolean dataSelected = Boolean.TRUE.equals(state.dataPreparationSelected());
        List<String> issues = new ArrayList<>();

        for (Gate gate : Gate.values()) {
            if (gate == Gate.DATA_PREPARATION && !dataSelected) {
                continue;
            }
            if (!state.isCompleted(gate)) {
                issues.add("gate " + gate.index() + " (" + gate.workerName() + ") did not complete");
            }
        }
        boolean requiredComplete = issues.isEmpty();

        Map<String, List<String>> deliverables = deliverables(results);
        for (Gate gate : Gate.values()) {
            if (!gate.requiresDeliverable() || gate == Gate.DATA_PREPARATION && !dataSelected) {
                continue;
            }
            if (deliverables.getOrDefault(gate.deliverableCategory(), List.of()).isEmpty()) {
                issues.add("missing deliverable '" + gate.deliverableCategory() + "' from gate " + gate.index());
            }
        }

        PipelineStatus status;
        if (!issues.isEmpty()) {
            status = PipelineStatus.FAILED;
        } else {
            status = statusFor(metrics.overallScore());
            if (status != PipelineStatus.SUCCESS) {
                issues.add("overall quality score " + metrics.overallScore() + " is below "
                        + properties.getPassThreshold());
            }
        }

        return new AuditRecord(state.request().requestId(), pipelineKey, status, metrics, requiredComplete,
                deliverables, summaries(results), issues, Instant.now());
    }

    public PipelineStatus statusFor(int overallScore) {
        if (overallScore >= properties.getPassThreshold()) {
            return PipelineStatus.SUCCESS;
        }
        if (overallScore >= properties.getPartialThreshold()) {
            return PipelineStatus.PARTIAL;
        }
        return PipelineStatus.FAILED;
    }

    /**
     * Artifact paths by category, read from each producing gate's deliverable field.
     */
    public static Map<String, List<String>> deliverables(Map<Gate, GateResult> results) {
        Map<String, List<String>> deliverables = new LinkedHashMap<>();
        for (Gate gate : Gate.values()) {
            GateResult result = results.get(gate);
            if (!gate.producesDeliverable() || result == null || !result.hasOutput()
                    || result.status() == GateStatus.FAILED) {
                continue;
            }
            List<String> paths = paths(result.output().get(gate.deliverableField()));
            if (!paths.isEmpty()) {
                deliverables.put(gate.deliverableCategory(), paths);
            }
        }
        return deliverables;
    }

    public static List<GateSummary> summaries(Map<Gate, GateResult> results) {
        List<GateSummary> summaries = new ArrayList<>();
        for (Gate gate : Gate.values()) {
            GateResult result = results.get(gate);
            if (result != null) {
                summaries.add(GateSummary.of(result));
            }
        }
        return summaries;
    }

    private static List<String> paths(JsonNode node) {
        List<String> paths = new ArrayList<>();
        if (node == null || node.isNull()) {
            return paths;
        }
        if (node.isArray()) {
            node.forEach(item -> {
                if (item.isTextual() && !item.asText().isBlank()) {
                    paths.add(item.asText());
                }
            });
        } else if (node.isTextual() && !node.asText().isBlank()) {
            paths.add(node.asText());
        }
        return paths;
    }

    private static Optional<JsonNode> output(Map<Gate, GateResult> results, Gate gate) {
        GateResult result = results.get(gate);
        return result != null && result.hasOutput()
                ? Optional.of(result.output()) : Optional.empty();
    }
}
