package com.gateflow.core.nodes;

import com.gateflow.core.engine.ActiveRuns;
import com.gateflow.core.engine.PipelineStateMachine;
import com.gateflow.core.engine.RunContext;
import com.gateflow.core.events.EventBus;
import com.gateflow.core.events.PipelineEvent;
import com.gateflow.core.metrics.GateflowMetrics;
import com.gateflow.core.model.DataPreparationPredicate;
import com.gateflow.core.model.PageContent;
import com.gateflow.core.model.PipelineState;
import com.gateflow.core.page.PageContentFetcher;
import com.gateflow.core.state.PipelineGraphState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * LangGraph4j node that prepares a run: fetches the target page once and decides whether
 * the data preparation gate runs.
 * <p>
 * The decision is persisted with the pipeline state. A resumed run reuses the stored
 * decision and never evaluates the predicate again.
 */
@Component
public class PreProcessingNode {

    private static final Logger log = LoggerFactory.getLogger(PreProcessingNode.class);

    private final ActiveRuns activeRuns;
    private final PageContentFetcher pageContentFetcher;
    private final PipelineStateMachine stateMachine;
    private final GateflowMetrics metrics;
    private final EventBus eventBus;

    public PreProcessingNode(ActiveRuns activeRuns, PageContentFetcher pageContentFetcher,
                             PipelineStateMachine stateMachine, GateflowMetrics metrics, EventBus eventBus) {
        this.activeRuns = activeRuns;
        this.pageContentFetcher = pageContentFetcher;
        this.stateMachine = stateMachine;
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(PipelineGraphState state) {
        RunContext run = activeRuns.require(state.requestId());
        if (run.abortSignal().isAborted()) {
            log.info("Run {} aborted before pre-processing", run.requestId());
            return Map.of(PipelineGraphState.ABORTED, true);
        }

        PageContent page = pageContentFetcher.fetch(run.request().url());
        run.setPage(page);

        PipelineState current = state.pipelineState();
        if (current.dataPreparationDecided()) {
            log.info("Reusing stored data preparation decision: {}", current.dataPreparationSelected());
            return Map.of();
        }

        var decision = DataPreparationPredicate.decide(run.request(), page);
        log.info("Data preparation {} ({})", decision.selected() ? "selected" : "skipped", decision.reason());
        metrics.recordDataPreparationDecision(decision.selected());

        PipelineState next = stateMachine.transition(current,
                current.withDataPreparationSelected(decision.selected(), Instant.now()));
        eventBus.publish(PipelineEvent.of(PipelineEvent.DATA_PREPARATION_DECIDED, run.requestId(),
                run.pipelineKey(), null, Map.of(
                        "selected", decision.selected(),
                        "reason", decision.reason(),
                        "matchedTerms", decision.matchedTerms())));
        return Map.of(PipelineGraphState.PIPELINE_STATE, next);
    }
}
