package com.gateflow.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a pipeline run, used for CLI progress output.
 *
 * @param eventType   event type (e.g. "pipeline.started", "gate.completed", "healing.attempted")
 * @param requestId   the run this event belongs to
 * @param pipelineKey state key of the pipeline record
 * @param gate        gate index the event relates to (nullable for pipeline-level events)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String requestId,
    String pipelineKey,
    Integer gate,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String PIPELINE_STARTED = "pipeline.started";
    public static final String PIPELINE_RESUMED = "pipeline.resumed";
    public static final String DATA_PREPARATION_DECIDED = "pipeline.data_preparation_decided";
    public static final String GATE_STARTED = "gate.started";
    public static final String GATE_COMPLETED = "gate.completed";
    public static final String EXECUTION_RUN = "execution.run";
    public static final String HEALING_ATTEMPTED = "healing.attempted";
    public static final String PIPELINE_ABORTED = "pipeline.aborted";
    public static final String PIPELINE_COMPLETED = "pipeline.completed";

    public static PipelineEvent of(String eventType, String requestId, String pipelineKey,
                                   Integer gate, Map<String, Object> payload) {
        return new PipelineEvent(eventType, requestId, pipelineKey, gate,
                payload != null ? payload : Map.of(), Instant.now());
    }
}
