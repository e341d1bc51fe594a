package com.gateflow.core.gate;

import com.gateflow.core.model.PageContent;
import com.gateflow.core.model.PipelineRequest;
import com.gateflow.core.persistence.StateKeys;

/**
 * Everything a gate needs from the run besides its upstream records.
 *
 * @param request the accepted request
 * @param page    page content fetched once during pre-processing
 */
public record GateContext(PipelineRequest request, PageContent page) {

    public String domain() {
        return request.domain();
    }

    public String feature() {
        return request.feature();
    }

    public String pipelineKey() {
        return StateKeys.pipeline(request.domain(), request.feature());
    }
}
