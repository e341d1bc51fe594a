package com.gateflow.core.gate;

import com.gateflow.core.GateflowProperties;
import com.gateflow.core.PipelineFixtures;
import com.gateflow.core.PipelineFixtures.ScriptedWorkers;
import com.gateflow.core.model.Gate;
import com.gateflow.core.model.GateResult;
import com.gateflow.core.model.GateStatus;
import com.gateflow.core.model.PageContent;
import com.gateflow.core.model.ValidationResult;
import com.gateflow.core.persistence.DurableWrites;
import com.gateflow.core.persistence.FileStateStore;
import com.gateflow.core.persistence.StateCodec;
import com.gateflow.core.persistence.StateKeys;
import com.gateflow.core.validation.ValidationEngine;
import com.gateflow.worker.WorkerRequest;
import com.gateflow.worker.WorkerResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GateExecutorTest {

    @TempDir
    Path stateDir;

    private FileStateStore store;
    private ScriptedWorkers workers;
    private GateExecutor executor;
    private GateContext context;

    @BeforeEach
    void setUp() {
        store = new FileStateStore(stateDir, StateCodec.objectMapper());
        workers = ScriptedWorkers.happyPath();
        executor = new GateExecutor(new DurableWrites(store), workers, new ValidationEngine(), new GateflowProperties());
        var request = PipelineFixtures.loginRequest();
        context = new GateContext(request, PipelineFixtures.pageWithInputs(request.url(), 2));
    }

    @Test
    @DisplayName("a valid output becomes a durable SUCCESS result")
    void successIsPersisted() {
        GateResult result = executor.execute(Gate.TEST_CASE_DESIGN, context);

        assertEquals(GateStatus.SUCCESS, result.status());
        assertEquals(100, result.validation().score());
        var stored = executor.loadResult(Gate.TEST_CASE_DESIGN, context);
        assertTrue(stored.isPresent());
        assertEquals(result.validation(), stored.get().validation());
        assertTrue(store.exists(StateKeys.gateOutput("docsearch", "login", Gate.TEST_CASE_DESIGN)));
    }

    @Test
    @DisplayName("replaying a gate on the same upstream state yields the same validation")
    void replayIsIdempotent() {
        executor.execute(Gate.TEST_CASE_DESIGN, context);
        workers.answer("element-mapper", PipelineFixtures.mappingOutput(60));

        GateResult first = executor.execute(Gate.ELEMENT_MAPPING, context);
        GateResult second = executor.execute(Gate.ELEMENT_MAPPING, context);

        assertEquals(first.validation().score(), second.validation().score());
        assertEquals(first.validation(), second.validation());
        assertEquals(first.status(), second.status());
        assertEquals(first.output(), second.output());
        assertEquals(second.validation(), executor.loadResult(Gate.ELEMENT_MAPPING, context).orElseThrow().validation());
    }

    @Test
    @DisplayName("upstream outputs and page content are handed to the worker")
    void upstreamIsSent() {
        executor.execute(Gate.TEST_CASE_DESIGN, context);
        executor.execute(Gate.ELEMENT_MAPPING, context);

        WorkerRequest mapperCall = workers.calls().get(1);
        assertEquals("element-mapper", mapperCall.worker());
        assertEquals(2, mapperCall.gate());
        assertEquals("TC-1", mapperCall.upstream().path("gate1").path("testCases").get(0).path("id").asText());
        assertEquals(2, mapperCall.fields().path("page").path("inputFields").size());
        assertEquals("docsearch", mapperCall.metadata().domain());
    }

    @Test
    @DisplayName("running a gate without its required predecessor is a contract violation")
    void contractViolation() {
        var violation = assertThrows(GateContractViolation.class,
                () -> executor.execute(Gate.ELEMENT_MAPPING, context));

        assertEquals(Gate.TEST_CASE_DESIGN, violation.getMissing());
        assertTrue(workers.calls().isEmpty());
    }

    @Test
    @DisplayName("compilation errors fail the code generation gate")
    void compilationErrorsFail() {
        workers.answer("code-generator", PipelineFixtures.codeOutput(2));
        executor.execute(Gate.TEST_CASE_DESIGN, context);
        executor.execute(Gate.ELEMENT_MAPPING, context);

        GateResult result = executor.execute(Gate.CODE_GENERATION, context);

        assertEquals(GateStatus.FAILED, result.status());
        assertFalse(result.validation().passed());
    }

    @Test
    @DisplayName("an invoker fault becomes a FAILED result without output")
    void invocationFailure() {
        workers.fail("test-case-designer", "connection refused");

        GateResult result = executor.execute(Gate.TEST_CASE_DESIGN, context);

        assertEquals(GateStatus.FAILED, result.status());
        assertFalse(result.hasOutput());
        assertTrue(result.validation().issues().get(0).startsWith(GateExecutor.INVOCATION_FAILURE));
        assertTrue(executor.loadResult(Gate.TEST_CASE_DESIGN, context).isPresent());
    }

    @Test
    @DisplayName("a worker-reported FAILED is final and keeps the output")
    void workerFailed() {
        workers.respond("test-case-designer", new WorkerResponse(WorkerResponse.FAILED,
                PipelineFixtures.designOutput(), new WorkerResponse.Validation(false, 10, List.of("gave up"))));

        GateResult result = executor.execute(Gate.TEST_CASE_DESIGN, context);

        assertEquals(GateStatus.FAILED, result.status());
        assertTrue(result.hasOutput());
        assertEquals(List.of("gave up"), result.validation().issues());
    }

    @Test
    @DisplayName("a worker-reported PARTIAL is never promoted")
    void partialNotPromoted() {
        workers.respond("test-case-designer", new WorkerResponse(WorkerResponse.PARTIAL,
                PipelineFixtures.designOutput(), null));

        GateResult result = executor.execute(Gate.TEST_CASE_DESIGN, context);

        assertEquals(100, result.validation().score());
        assertEquals(GateStatus.PARTIAL, result.status());
    }

    @Test
    @DisplayName("status thresholds: 70 and above SUCCESS, 50 to 69 PARTIAL, below FAILED")
    void thresholds() {
        var passed = new ValidationResult(70, List.of(), true);
        var partial = new ValidationResult(50, List.of(), true);
        var low = new ValidationResult(49, List.of(), true);
        var issues = new ValidationResult(95, List.of("x"), false);

        assertEquals(GateStatus.SUCCESS, executor.statusFor(passed));
        assertEquals(GateStatus.PARTIAL, executor.statusFor(partial));
        assertEquals(GateStatus.FAILED, executor.statusFor(low));
        assertEquals(GateStatus.FAILED, executor.statusFor(issues));
    }

    @Test
    @DisplayName("an unavailable page is still described to the worker")
    void unavailablePage() {
        var unavailable = new GateContext(context.request(), PageContent.unavailable(context.request().url()));

        executor.execute(Gate.TEST_CASE_DESIGN, unavailable);

        assertFalse(workers.calls().get(0).fields().path("page").path("available").asBoolean(true));
    }
}
