package com.gateflow.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GateflowMetricsTest {

    private SimpleMeterRegistry registry;
    private GateflowMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new GateflowMetrics(registry);
    }

    @Test
    @DisplayName("recordGateDuration records by gate and worker tag")
    void recordGateDuration() {
        metrics.recordGateDuration(2, "element-mapper", 1200);
        var timer = registry.find("gateflow.gate.duration")
                .tag("gate", "2").tag("worker", "element-mapper").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordGateResult increments by gate and status")
    void recordGateResult() {
        metrics.recordGateResult(1, "SUCCESS");
        metrics.recordGateResult(1, "SUCCESS");
        metrics.recordGateResult(2, "PARTIAL");

        assertEquals(2.0, registry.find("gateflow.gate.results").tag("gate", "1").tag("status", "SUCCESS")
                .counter().count());
        assertEquals(1.0, registry.find("gateflow.gate.results").tag("gate", "2").tag("status", "PARTIAL")
                .counter().count());
    }

    @Test
    @DisplayName("data preparation decisions are split by outcome")
    void recordDataPreparationDecision() {
        metrics.recordDataPreparationDecision(true);
        metrics.recordDataPreparationDecision(false);
        metrics.recordDataPreparationDecision(false);

        assertEquals(1.0, registry.find("gateflow.data_preparation.decisions").tag("selected", "true")
                .counter().count());
        assertEquals(2.0, registry.find("gateflow.data_preparation.decisions").tag("selected", "false")
                .counter().count());
    }

    @Test
    @DisplayName("execution runs and healing attempts are counted")
    void recordExecutionAndHealing() {
        metrics.recordExecutionRun(false);
        metrics.recordExecutionRun(true);
        metrics.recordHealingAttempt("SUCCESS");

        assertEquals(1.0, registry.find("gateflow.execution.runs").tag("passed", "false").counter().count());
        assertEquals(1.0, registry.find("gateflow.healing.attempts").tag("outcome", "SUCCESS").counter().count());
    }

    @Test
    @DisplayName("recordPipelineResult increments by status tag")
    void recordPipelineResult() {
        metrics.recordPipelineResult("SUCCESS");
        metrics.recordPipelineResult("FAILED");
        metrics.recordPipelineResult("SUCCESS");

        assertEquals(2.0, registry.find("gateflow.pipelines.total").tag("status", "SUCCESS").counter().count());
        assertEquals(1.0, registry.find("gateflow.pipelines.total").tag("status", "FAILED").counter().count());
    }

    @Test
    @DisplayName("pipeline duration and overall score are recorded")
    void recordDurationAndScore() {
        metrics.recordPipelineDuration(90_000);
        metrics.recordOverallScore(87);

        assertEquals(1, registry.find("gateflow.pipeline.duration").timer().count());
        var summary = registry.find("gateflow.audit.overall_score").summary();
        assertNotNull(summary);
        assertEquals(87.0, summary.totalAmount());
    }

    @Test
    @DisplayName("auxiliary write failures are tagged by record")
    void incrementAuxiliaryWriteFailures() {
        metrics.incrementAuxiliaryWriteFailures("audit");
        assertEquals(1.0, registry.find("gateflow.state.auxiliary_write_failures").tag("record", "audit")
                .counter().count());
    }
}
