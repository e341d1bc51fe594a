package com.gateflow.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.gateflow.core.model.Gate;
import com.gateflow.core.model.PipelineRequest;

import java.util.EnumMap;
import java.util.Map;

/**
 * Request plus the durable outputs of the gates that ran before the one being validated.
 *
 * @param request the originating request
 * @param outputs predecessor outputs keyed by gate; only gates that produced output appear
 */
public record UpstreamArtifacts(PipelineRequest request, Map<Gate, JsonNode> outputs) {

    public UpstreamArtifacts {
        outputs = outputs != null && !outputs.isEmpty() ? new EnumMap<>(outputs) : new EnumMap<>(Gate.class);
    }

    public static UpstreamArtifacts of(PipelineRequest request) {
        return new UpstreamArtifacts(request, Map.of());
    }

    /**
     * Output of the given gate, or a missing node if it did not run.
     */
    public JsonNode output(Gate gate) {
        JsonNode node = outputs.get(gate);
        return node != null ? node : MissingNode.getInstance();
    }

    public boolean has(Gate gate) {
        return outputs.containsKey(gate);
    }
}
