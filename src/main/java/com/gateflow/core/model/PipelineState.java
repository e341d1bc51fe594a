package com.gateflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Durable progress record of one pipeline, stored under {@code {domain}-{feature}-pipeline}.
 * <p>
 * Instances are immutable; every transition produces a new value which is written through
 * to the state store before the next gate starts.
 *
 * @param status                   overall status
 * @param currentGate              index of the last gate that finished (-1 before the first)
 * @param completedGates           gates that finished with SUCCESS or PARTIAL, strictly increasing
 * @param dataPreparationSelected  outcome of the data preparation decision; null until evaluated
 * @param failedGate               index of the gate that halted the run, or null
 * @param failureReason            human-readable reason for a FAILED status, or null
 * @param request                  snapshot of the originating request
 * @param startedAt                when the pipeline was first started
 * @param updatedAt                when this value was produced
 */
public record PipelineState(
    PipelineStatus status,
    int currentGate,
    List<Integer> completedGates,
    Boolean dataPreparationSelected,
    Integer failedGate,
    String failureReason,
    PipelineRequest request,
    Instant startedAt,
    Instant updatedAt
) implements Serializable {

    public PipelineState {
        completedGates = completedGates != null ? List.copyOf(completedGates) : List.of();
    }

    public static PipelineState started(PipelineRequest request, Instant now) {
        return new PipelineState(PipelineStatus.IN_PROGRESS, -1, List.of(), null, null, null,
                request, now, now);
    }

    public boolean isCompleted(Gate gate) {
        return completedGates.contains(gate.index());
    }

    public boolean dataPreparationDecided() {
        return dataPreparationSelected != null;
    }

    public PipelineState withDataPreparationSelected(boolean selected, Instant now) {
        return new PipelineState(status, currentGate, completedGates, selected, failedGate,
                failureReason, request, startedAt, now);
    }

    public PipelineState withGateCompleted(Gate gate, Instant now) {
        var gates = new ArrayList<>(completedGates);
        gates.add(gate.index());
        return new PipelineState(status, gate.index(), gates, dataPreparationSelected, failedGate,
                failureReason, request, startedAt, now);
    }

    public PipelineState withGateFailed(Gate gate, String reason, Instant now) {
        return new PipelineState(PipelineStatus.FAILED, Math.max(currentGate, gate.index()), completedGates,
                dataPreparationSelected, gate.index(), reason, request, startedAt, now);
    }

    public PipelineState withStatus(PipelineStatus newStatus, String reason, Instant now) {
        return new PipelineState(newStatus, currentGate, completedGates, dataPreparationSelected,
                failedGate, reason, request, startedAt, now);
    }

    /**
     * True when both values describe the same progress, ignoring {@link #updatedAt}.
     * Used to make repeated writes of an unchanged state a no-op.
     */
    public boolean sameProgressAs(PipelineState other) {
        return other != null
                && status == other.status
                && currentGate == other.currentGate
                && completedGates.equals(other.completedGates)
                && Objects.equals(dataPreparationSelected, other.dataPreparationSelected)
                && Objects.equals(failedGate, other.failedGate)
                && Objects.equals(failureReason, other.failureReason)
                && Objects.equals(request, other.request);
    }
}
