package com.gateflow.core.page;

import com.gateflow.core.model.PageContent;

/**
 * Fetches the target page once per run.
 * <p>
 * Implementations never throw for an unreachable page: they return
 * {@link PageContent#unavailable(String)} so the run can proceed on the request alone.
 */
public interface PageContentFetcher {

    PageContent fetch(String url);
}
