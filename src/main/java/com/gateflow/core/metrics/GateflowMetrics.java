package com.gateflow.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pipeline execution.
 */
@Service
public class GateflowMetrics {

    private final MeterRegistry registry;

    public GateflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordGateDuration(int gate, String worker, long ms) {
        Timer.builder("gateflow.gate.duration")
                .tag("gate", String.valueOf(gate))
                .tag("worker", worker)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGateResult(int gate, String status) {
        Counter.builder("gateflow.gate.results")
                .tag("gate", String.valueOf(gate))
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordDataPreparationDecision(boolean selected) {
        Counter.builder("gateflow.data_preparation.decisions")
                .tag("selected", String.valueOf(selected))
                .register(registry)
                .increment();
    }

    /**
     * Records one execution run of the execution gate.
     *
     * @param passed whether every test in the run passed
     */
    public void recordExecutionRun(boolean passed) {
        Counter.builder("gateflow.execution.runs")
                .tag("passed", String.valueOf(passed))
                .register(registry)
                .increment();
    }

    public void recordHealingAttempt(String outcome) {
        Counter.builder("gateflow.healing.attempts")
                .description("Healing worker invocations inside the execution gate")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordPipelineResult(String status) {
        Counter.builder("gateflow.pipelines.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordPipelineDuration(long ms) {
        Timer.builder("gateflow.pipeline.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordOverallScore(int score) {
        DistributionSummary.builder("gateflow.audit.overall_score")
                .description("Overall quality score assigned by the final audit")
                .register(registry)
                .record(score);
    }

    public void incrementAuxiliaryWriteFailures(String record) {
        Counter.builder("gateflow.state.auxiliary_write_failures")
                .tag("record", record)
                .register(registry)
                .increment();
    }
}
