package com.gateflow.core.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.gateflow.core.GateflowProperties;
import com.gateflow.core.PipelineFixtures;
import com.gateflow.core.model.Gate;
import com.gateflow.core.model.GateResult;
import com.gateflow.core.model.GateStatus;
import com.gateflow.core.model.PipelineState;
import com.gateflow.core.model.PipelineStatus;
import com.gateflow.core.model.QualityMetrics;
import com.gateflow.core.model.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.gateflow.core.PipelineFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class QualityScorerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private QualityScorer scorer;
    private Map<Gate, GateResult> results;

    @BeforeEach
    void setUp() {
        scorer = new QualityScorer(new GateflowProperties());
        results = new EnumMap<>(Gate.class);
        put(Gate.TEST_CASE_DESIGN, designOutput());
        put(Gate.ELEMENT_MAPPING, mappingOutput(95));
        put(Gate.CODE_GENERATION, codeOutput(0));
        put(Gate.EXECUTION, passingRun());
        put(Gate.LEARNING_CAPTURE, learningOutput());
    }

    private void put(Gate gate, JsonNode output) {
        results.put(gate, new GateResult(gate.index(), gate.workerName(), GateStatus.SUCCESS, output,
                new ValidationResult(100, List.of(), true), 10, T0));
    }

    private static PipelineState completed(boolean dataSelected, Gate... gates) {
        var state = PipelineState.started(PipelineFixtures.loginRequest(), T0)
                .withDataPreparationSelected(dataSelected, T0);
        for (Gate gate : gates) {
            state = state.withGateCompleted(gate, T0);
        }
        return state;
    }

    private static PipelineState allRequired() {
        return completed(false, Gate.TEST_CASE_DESIGN, Gate.ELEMENT_MAPPING, Gate.CODE_GENERATION,
                Gate.EXECUTION, Gate.LEARNING_CAPTURE);
    }

    @Nested
    @DisplayName("Metrics")
    class Metrics {

        @Test
        @DisplayName("the overall score weighs the four figures equally")
        void weightedScore() {
            QualityMetrics metrics = scorer.metrics(allRequired(), results);

            assertEquals(100, metrics.coverage());
            assertEquals(95, metrics.locatorConfidence());
            assertTrue(metrics.compiles());
            assertEquals(100, metrics.passRate());
            assertEquals(99, metrics.overallScore());
        }

        @Test
        void failingTestsLowerThePassRate() {
            put(Gate.EXECUTION, failingRun("TimeoutError"));

            QualityMetrics metrics = scorer.metrics(allRequired(), results);

            assertEquals(50, metrics.passRate());
            assertEquals(86, metrics.overallScore());
        }

        @Test
        void compilationErrorsMeanNoCompileCredit() {
            put(Gate.CODE_GENERATION, codeOutput(3));
            assertFalse(scorer.metrics(allRequired(), results).compiles());
        }

        @Test
        void missingGatesContributeZero() {
            assertEquals(QualityMetrics.none(), scorer.metrics(allRequired(), Map.of()));
        }
    }

    @Nested
    @DisplayName("Audit")
    class Audit {

        @Test
        void completeHighQualityRunSucceeds() {
            AuditRecord audit = scorer.audit(allRequired(), results, "docsearch-login-pipeline");

            assertEquals(PipelineStatus.SUCCESS, audit.status());
            assertTrue(audit.requiredComplete());
            assertTrue(audit.issues().isEmpty());
            assertEquals(List.of("pages/LoginPage.ts"), audit.deliverables().get("pageObjects"));
            assertEquals(List.of("tests/login.spec.ts"), audit.deliverables().get("tests"));
            assertEquals(List.of("learnings/login.md"), audit.deliverables().get("learnings"));
            assertEquals(5, audit.gates().size());
        }

        @Test
        @DisplayName("a score between the thresholds is PARTIAL")
        void middlingScoreIsPartial() {
            put(Gate.ELEMENT_MAPPING, mappingOutput(40));
            put(Gate.EXECUTION, json("""
                    {"total": 4, "passed": 0, "failed": 4, "error": "boom"}
                    """));

            AuditRecord audit = scorer.audit(allRequired(), results, "docsearch-login-pipeline");

            assertEquals(60, audit.qualityMetrics().overallScore());
            assertEquals(PipelineStatus.PARTIAL, audit.status());
            assertEquals(List.of("overall quality score 60 is below 70"), audit.issues());
        }

        @Test
        void incompleteGateFailsRegardlessOfScore() {
            var state = completed(false, Gate.TEST_CASE_DESIGN, Gate.ELEMENT_MAPPING, Gate.CODE_GENERATION,
                    Gate.EXECUTION);

            AuditRecord audit = scorer.audit(state, results, "docsearch-login-pipeline");

            assertEquals(PipelineStatus.FAILED, audit.status());
            assertFalse(audit.requiredComplete());
            assertEquals(List.of("gate 5 (learning-recorder) did not complete"), audit.issues());
        }

        @Test
        void selectedDataPreparationBecomesRequired() {
            var state = completed(true, Gate.TEST_CASE_DESIGN, Gate.ELEMENT_MAPPING, Gate.CODE_GENERATION,
                    Gate.EXECUTION, Gate.LEARNING_CAPTURE);

            AuditRecord audit = scorer.audit(state, results, "docsearch-login-pipeline");

            assertEquals(PipelineStatus.FAILED, audit.status());
            assertTrue(audit.issues().contains("gate 0 (data-preparer) did not complete"));
        }

        @Test
        void missingRequiredDeliverableFails() {
            put(Gate.CODE_GENERATION, json("""
                    {"compilationErrors": 0, "testFiles": []}
                    """));

            AuditRecord audit = scorer.audit(allRequired(), results, "docsearch-login-pipeline");

            assertEquals(PipelineStatus.FAILED, audit.status());
            assertTrue(audit.requiredComplete());
            assertEquals(List.of("missing deliverable 'tests' from gate 3"), audit.issues());
        }

        @Test
        void learningFileIsReportedButNotRequired() {
            put(Gate.LEARNING_CAPTURE, json("""
                    {"learnings": []}
                    """));

            AuditRecord audit = scorer.audit(allRequired(), results, "docsearch-login-pipeline");

            assertEquals(PipelineStatus.SUCCESS, audit.status());
            assertFalse(audit.deliverables().containsKey("learnings"));
        }

        @Test
        void failedGateDeliverablesAreIgnored() {
            results.put(Gate.ELEMENT_MAPPING, new GateResult(2, "element-mapper", GateStatus.FAILED,
                    mappingOutput(10), ValidationResult.failure("low confidence"), 10, T0));

            assertFalse(QualityScorer.deliverables(results).containsKey("pageObjects"));
        }
    }

    @Test
    void thresholdsDecideStatus() {
        assertEquals(PipelineStatus.SUCCESS, scorer.statusFor(70));
        assertEquals(PipelineStatus.PARTIAL, scorer.statusFor(69));
        assertEquals(PipelineStatus.PARTIAL, scorer.statusFor(50));
        assertEquals(PipelineStatus.FAILED, scorer.statusFor(49));
    }
}
