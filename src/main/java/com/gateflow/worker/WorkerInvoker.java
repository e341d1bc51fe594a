package com.gateflow.worker;

import java.time.Duration;

/**
 * Synchronous call to an external worker.
 * <p>
 * Blocks until the worker answers or the timeout elapses. Implementations never return a
 * partial response: every failure surfaces as a {@link WorkerInvocationException}.
 */
public interface WorkerInvoker {

    /**
     * @throws WorkerInvocationException on timeout, crash, transport error or malformed response
     */
    WorkerResponse invoke(WorkerRequest request, Duration timeout);
}
