package com.gateflow.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing pipeline MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String REQUEST_ID = "requestId";
    public static final String PIPELINE_KEY = "pipelineKey";
    public static final String GATE = "gate";
    public static final String RUN = "run";

    private MdcContext() {}

    public static void setPipeline(String requestId, String pipelineKey) {
        MDC.put(REQUEST_ID, requestId);
        MDC.put(PIPELINE_KEY, pipelineKey);
    }

    public static void setGate(int gate) {
        MDC.put(GATE, String.valueOf(gate));
        MDC.remove(RUN);
    }

    public static void setRun(int runNumber) {
        MDC.put(RUN, String.valueOf(runNumber));
    }

    public static void clearRun() {
        MDC.remove(RUN);
    }

    public static void clearGate() {
        MDC.remove(GATE);
        MDC.remove(RUN);
    }

    public static void clear() {
        MDC.remove(REQUEST_ID);
        MDC.remove(PIPELINE_KEY);
        MDC.remove(GATE);
        MDC.remove(RUN);
    }
}
