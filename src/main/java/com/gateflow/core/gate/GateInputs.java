package com.gateflow.core.gate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gateflow.core.model.Gate;
import com.gateflow.core.model.PageContent;
import com.gateflow.core.model.PipelineRequest;
import com.gateflow.core.validation.UpstreamArtifacts;
import com.gateflow.worker.WorkerRequest;

/**
 * Builds the worker payload for a gate from the request, the cached page and upstream outputs.
 */
public final class GateInputs {

    /** Page text beyond this many characters is cut before it is handed to a worker. */
    static final int MAX_PAGE_TEXT = 20_000;

    private GateInputs() {}

    public static WorkerRequest request(Gate gate, String worker, GateContext context,
                                        UpstreamArtifacts upstream, ObjectNode extraFields,
                                        ObjectMapper objectMapper) {
        PipelineRequest req = context.request();
        var metadata = new WorkerRequest.Metadata(req.requestId(), req.domain(), req.feature(), req.url());
        ObjectNode fields = fields(gate, context, objectMapper);
        if (extraFields != null) {
            fields.setAll(extraFields);
        }
        return new WorkerRequest(metadata, gate.index(), worker, fields, upstream(upstream, objectMapper));
    }

    static ObjectNode fields(Gate gate, GateContext context, ObjectMapper objectMapper) {
        PipelineRequest req = context.request();
        ObjectNode fields = objectMapper.createObjectNode();
        fields.put("userStory", req.userStory());
        ArrayNode criteria = fields.putArray("acceptanceCriteria");
        req.acceptanceCriteria().forEach(criteria::add);
        fields.put("testTarget", req.testTarget().name());
        ObjectNode auth = fields.putObject("authentication");
        auth.put("type", req.authentication().type().name());
        auth.put("credentialsRef", req.authentication().credentialsRef());

        if (gate.usesPageContent() && context.page() != null) {
            fields.set("page", page(context.page(), objectMapper));
        }

        switch (gate) {
            case DATA_PREPARATION -> {
                ObjectNode data = fields.putObject("dataRequirements");
                data.put("mode", req.dataRequirements().mode().name());
                data.put("count", req.dataRequirements().count());
                if (req.dataRequirements().seed() != null) {
                    data.put("seed", req.dataRequirements().seed());
                }
            }
            case CODE_GENERATION, EXECUTION -> {
                ObjectNode constraints = fields.putObject("constraints");
                constraints.put("timeoutSeconds", req.constraints().timeoutSeconds());
                constraints.put("retries", req.constraints().retries());
                ArrayNode browsers = constraints.putArray("browsers");
                req.constraints().browsers().forEach(browsers::add);
            }
            default -> { }
        }
        return fields;
    }

    static ObjectNode upstream(UpstreamArtifacts upstream, ObjectMapper objectMapper) {
        ObjectNode node = objectMapper.createObjectNode();
        if (upstream != null) {
            upstream.outputs().forEach((gate, output) -> node.set("gate" + gate.index(), output));
        }
        return node;
    }

    private static ObjectNode page(PageContent page, ObjectMapper objectMapper) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("url", page.url());
        node.put("available", page.available());
        node.put("title", page.title());
        String text = page.text() != null ? page.text() : "";
        node.put("text", text.length() > MAX_PAGE_TEXT ? text.substring(0, MAX_PAGE_TEXT) : text);
        ArrayNode inputs = node.putArray("inputFields");
        for (PageContent.InputField field : page.inputFields()) {
            ObjectNode input = inputs.addObject();
            input.put("tag", field.tag());
            input.put("type", field.type());
            input.put("name", field.name());
            input.put("id", field.id());
        }
        return node;
    }
}
