package com.gateflow.core.state;

import com.gateflow.core.model.HealingReport;
import com.gateflow.core.model.PipelineState;
import com.gateflow.core.model.PipelineStatus;
import com.gateflow.core.model.QualityMetrics;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Graph state for one pipeline run.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. The durable
 * {@link PipelineState} travels through the graph explicitly; runtime objects that must not
 * be copied (abort signal, page content) live in the run registry, looked up by requestId.
 */
public class PipelineGraphState extends AgentState {

    public static final String REQUEST_ID = "requestId";
    public static final String PIPELINE_KEY = "pipelineKey";
    public static final String PIPELINE_STATE = "pipelineState";
    public static final String HEALING_REPORT = "healingReport";
    public static final String QUALITY_METRICS = "qualityMetrics";
    public static final String AUDIT_TRAIL = "auditTrail";
    public static final String ABORTED = "aborted";
    public static final String ISSUES = "issues";

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Scalar channels ──────────────────────────────────────────
        Map.entry(REQUEST_ID,      Channels.base(() -> "")),
        Map.entry(PIPELINE_KEY,    Channels.base(() -> "")),
        Map.entry(PIPELINE_STATE,  Channels.base((Reducer<PipelineState>) null)),
        Map.entry(HEALING_REPORT,  Channels.base((Reducer<HealingReport>) null)),
        Map.entry(QUALITY_METRICS, Channels.base((Reducer<QualityMetrics>) null)),
        Map.entry(AUDIT_TRAIL,     Channels.base(() -> "")),
        Map.entry(ABORTED,         Channels.base(() -> false)),

        // ── Appender channels (list accumulation) ────────────────────
        Map.entry(ISSUES,          Channels.appender(ArrayList::new))
    );

    public PipelineGraphState(Map<String, Object> initData) {
        super(initData);
    }

    public String requestId() {
        return this.<String>value(REQUEST_ID).orElse("");
    }

    public String pipelineKey() {
        return this.<String>value(PIPELINE_KEY).orElse("");
    }

    /**
     * @throws IllegalStateException if the coordinator did not seed the state
     */
    public PipelineState pipelineState() {
        return this.<PipelineState>value(PIPELINE_STATE)
                .orElseThrow(() -> new IllegalStateException("Graph state has no pipeline state"));
    }

    public PipelineStatus status() {
        return pipelineState().status();
    }

    public Optional<HealingReport> healingReport() {
        return value(HEALING_REPORT);
    }

    public Optional<QualityMetrics> qualityMetrics() {
        return value(QUALITY_METRICS);
    }

    public String auditTrail() {
        return this.<String>value(AUDIT_TRAIL).orElse("");
    }

    public boolean aborted() {
        return this.<Boolean>value(ABORTED).orElse(false);
    }

    public List<String> issues() {
        return this.<List<String>>value(ISSUES).orElse(List.of());
    }
}
