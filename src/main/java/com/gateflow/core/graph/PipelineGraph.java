package com.gateflow.core.graph;

import com.gateflow.core.model.Gate;
import com.gateflow.core.model.PipelineState;
import com.gateflow.core.model.PipelineStatus;
import com.gateflow.core.nodes.FinalAuditNode;
import com.gateflow.core.nodes.PreProcessingNode;
import com.gateflow.core.nodes.RunGateNode;
import com.gateflow.core.state.PipelineGraphState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives a pipeline run.
 * <p>
 * Topology:
 * <pre>
 *   START -> pre_processing -> [routeAfterPreProcessing]
 *            -> gate_0 -> [routeAfterGate] -> gate_1
 *            -> gate_1 -> [routeAfterGate] -> gate_2 -> ... -> gate_5
 *                                         -> final_audit -> END
 *   any gate that FAILED, or an aborted run -> END
 * </pre>
 * The conditional edges are the only transition guards; nodes never pick their successor.
 */
@Component
public class PipelineGraph {

    private static final Logger log = LoggerFactory.getLogger(PipelineGraph.class);

    static final String PRE_PROCESSING = "pre_processing";
    static final String FINAL_AUDIT = "final_audit";

    private final CompiledGraph<PipelineGraphState> compiledGraph;

    public PipelineGraph(PreProcessingNode preProcessingNode,
                         RunGateNode runGateNode,
                         FinalAuditNode finalAuditNode) throws Exception {

        var graph = new StateGraph<>(PipelineGraphState.SCHEMA, PipelineGraphState::new)
                .addNode(PRE_PROCESSING, node_async(preProcessingNode::apply));
        for (Gate gate : Gate.values()) {
            graph.addNode(gate.nodeId(), node_async(state -> runGateNode.apply(gate, state)));
        }
        graph.addNode(FINAL_AUDIT, node_async(finalAuditNode::apply))
                .addEdge(START, PRE_PROCESSING)
                .addConditionalEdges(PRE_PROCESSING,
                        edge_async(this::routeAfterPreProcessing),
                        Map.of(Gate.DATA_PREPARATION.nodeId(), Gate.DATA_PREPARATION.nodeId(),
                                Gate.TEST_CASE_DESIGN.nodeId(), Gate.TEST_CASE_DESIGN.nodeId(),
                                END, END));
        for (Gate gate : Gate.values()) {
            String onward = gate.next() != null ? gate.next().nodeId() : FINAL_AUDIT;
            Map<String, String> targets = new HashMap<>();
            targets.put(onward, onward);
            targets.put(END, END);
            graph.addConditionalEdges(gate.nodeId(), edge_async(state -> routeAfterGate(gate, state)), targets);
        }
        graph.addEdge(FINAL_AUDIT, END);

        this.compiledGraph = graph.compile(CompileConfig.builder().build());
        log.info("Pipeline graph compiled ({} gate nodes)", Gate.values().length);
    }

    /**
     * Data preparation runs only when the persisted decision selected it.
     */
    String routeAfterPreProcessing(PipelineGraphState state) {
        if (state.aborted()) {
            return END;
        }
        PipelineState pipeline = state.pipelineState();
        return Boolean.TRUE.equals(pipeline.dataPreparationSelected())
                ? Gate.DATA_PREPARATION.nodeId()
                : Gate.TEST_CASE_DESIGN.nodeId();
    }

    /**
     * A FAILED gate or an abort ends the run; otherwise the next gate, and the audit after
     * the last one.
     */
    String routeAfterGate(Gate gate, PipelineGraphState state) {
        if (state.aborted() || state.status() == PipelineStatus.FAILED) {
            return END;
        }
        Gate next = gate.next();
        return next != null ? next.nodeId() : FINAL_AUDIT;
    }

    public CompiledGraph<PipelineGraphState> getCompiledGraph() {
        return compiledGraph;
    }
}
