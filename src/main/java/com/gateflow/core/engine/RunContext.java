package com.gateflow.core.engine;

import com.gateflow.core.gate.GateContext;
import com.gateflow.core.model.PageContent;
import com.gateflow.core.model.PipelineRequest;

/**
 * Per-run objects that do not belong in the graph state: the abort signal and the page
 * content fetched during pre-processing.
 */
public class RunContext {

    private final PipelineRequest request;
    private final String pipelineKey;
    private final AbortSignal abortSignal;
    private volatile PageContent page;

    public RunContext(PipelineRequest request, String pipelineKey, AbortSignal abortSignal) {
        this.request = request;
        this.pipelineKey = pipelineKey;
        this.abortSignal = abortSignal != null ? abortSignal : AbortSignal.none();
    }

    public PipelineRequest request() {
        return request;
    }

    public String requestId() {
        return request.requestId();
    }

    public String pipelineKey() {
        return pipelineKey;
    }

    public AbortSignal abortSignal() {
        return abortSignal;
    }

    public PageContent page() {
        return page;
    }

    public void setPage(PageContent page) {
        this.page = page;
    }

    public GateContext gateContext() {
        return new GateContext(request, page != null ? page : PageContent.unavailable(request.url()));
    }
}
