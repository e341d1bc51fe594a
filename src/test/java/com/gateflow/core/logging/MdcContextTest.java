package com.gateflow.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setPipeline puts requestId and pipelineKey in MDC")
    void setPipeline() {
        MdcContext.setPipeline("GF-2026-0000ABCD", "docsearch-login-pipeline");
        assertEquals("GF-2026-0000ABCD", MDC.get("requestId"));
        assertEquals("docsearch-login-pipeline", MDC.get("pipelineKey"));
    }

    @Test
    @DisplayName("setGate replaces the gate and drops a stale run number")
    void setGate() {
        MdcContext.setGate(4);
        MdcContext.setRun(3);
        MdcContext.setGate(5);
        assertEquals("5", MDC.get("gate"));
        assertNull(MDC.get("run"));
    }

    @Test
    @DisplayName("clearGate keeps the pipeline keys")
    void clearGate() {
        MdcContext.setPipeline("GF-1", "k");
        MdcContext.setGate(2);
        MdcContext.clearGate();
        assertNull(MDC.get("gate"));
        assertEquals("GF-1", MDC.get("requestId"));
    }

    @Test
    @DisplayName("clear removes all gateflow MDC keys")
    void clear() {
        MdcContext.setPipeline("GF-1", "k");
        MdcContext.setGate(4);
        MdcContext.setRun(1);
        MdcContext.clear();
        assertNull(MDC.get("requestId"));
        assertNull(MDC.get("pipelineKey"));
        assertNull(MDC.get("gate"));
        assertNull(MDC.get("run"));
    }
}
