package com.gateflow.dispatch.api;

import com.gateflow.core.PipelineFixtures;
import com.gateflow.core.classify.ClassificationResult;
import com.gateflow.core.classify.RequestClassifier;
import com.gateflow.core.engine.PipelineCoordinator;
import com.gateflow.core.model.HealingReport;
import com.gateflow.core.model.PipelineRequest;
import com.gateflow.core.model.PipelineResult;
import com.gateflow.core.model.PipelineState;
import com.gateflow.core.model.PipelineStatus;
import com.gateflow.core.model.QualityMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PipelineController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
@Import(PipelineControllerTest.DirectExecutorConfig.class)
class PipelineControllerTest {

    @TestConfiguration
    static class DirectExecutorConfig {
        @Bean(name = "pipelineExecutor")
        Executor pipelineExecutor() {
            return Runnable::run;
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PipelineCoordinator coordinator;

    @MockitoBean
    private RequestClassifier classifier;

    private static PipelineResult result(PipelineStatus status) {
        return new PipelineResult(status, "GF-2026-TEST0001", "docsearch-login-pipeline", 1200L,
                List.of(), Map.of("tests", List.of("tests/login.spec.ts")), QualityMetrics.none(),
                HealingReport.empty(), "audit ok", null, List.of(), false);
    }

    private void classifyAs(PipelineRequest request) {
        when(classifier.classify(anyString()))
                .thenReturn(ClassificationResult.accepted(request, "structured request"));
    }

    @Test
    @DisplayName("submit returns 202 with a Location header and runs the pipeline")
    void acceptsValidRequest() throws Exception {
        classifyAs(PipelineFixtures.loginRequest());
        when(coordinator.isRunning("docsearch", "login")).thenReturn(false);
        when(coordinator.run(any())).thenReturn(result(PipelineStatus.SUCCESS));

        mockMvc.perform(post("/api/v1/pipelines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"domain\":\"docsearch\",\"feature\":\"login\"}"))
                .andExpect(status().isAccepted())
                .andExpect(header().string("Location", "/api/v1/pipelines/docsearch/login"))
                .andExpect(jsonPath("$.request_id").value(startsWith("GF-")))
                .andExpect(jsonPath("$.pipeline_key").value("docsearch-login-pipeline"))
                .andExpect(jsonPath("$.status").value("IN_PROGRESS"));

        verify(coordinator).run(any());
    }

    @Test
    @DisplayName("submit returns 400 with the missing fields when the text is not a pipeline request")
    void rejectsUnclassifiableText() throws Exception {
        when(classifier.classify(anyString())).thenReturn(
                ClassificationResult.rejected("no URL found", List.of("url", "acceptance criteria")));

        mockMvc.perform(post("/api/v1/pipelines")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("please test something"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("no URL found"))
                .andExpect(jsonPath("$.missing", hasSize(2)))
                .andExpect(jsonPath("$.missing[0]").value("url"));

        verify(coordinator, never()).run(any());
    }

    @Test
    @DisplayName("submit returns 400 with violations when the request fails validation")
    void rejectsInvalidRequest() throws Exception {
        var base = PipelineFixtures.loginRequest();
        classifyAs(new PipelineRequest(null, base.domain(), base.feature(), "ftp://docsearch",
                base.userStory(), base.acceptanceCriteria(), null, null, null, null));

        mockMvc.perform(post("/api/v1/pipelines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid pipeline request"))
                .andExpect(jsonPath("$.violations", hasItem(containsString("absolute http(s) URL"))));

        verify(coordinator, never()).run(any());
    }

    @Test
    @DisplayName("submit returns 409 when the same pipeline is already running")
    void conflictWhenRunning() throws Exception {
        classifyAs(PipelineFixtures.loginRequest());
        when(coordinator.isRunning("docsearch", "login")).thenReturn(true);

        mockMvc.perform(post("/api/v1/pipelines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value(containsString("already running")));

        verify(coordinator, never()).run(any());
    }

    @Test
    @DisplayName("status returns the stored result and the running flag")
    void statusFound() throws Exception {
        when(coordinator.status("docsearch", "login")).thenReturn(Optional.of(result(PipelineStatus.PARTIAL)));
        when(coordinator.isRunning("docsearch", "login")).thenReturn(false);

        mockMvc.perform(get("/api/v1/pipelines/docsearch/login"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(false))
                .andExpect(jsonPath("$.result.status").value("PARTIAL"))
                .andExpect(jsonPath("$.result.pipelineKey").value("docsearch-login-pipeline"))
                .andExpect(jsonPath("$.result.deliverables.tests[0]").value("tests/login.spec.ts"));
    }

    @Test
    @DisplayName("status returns 404 for an unknown pipeline")
    void statusNotFound() throws Exception {
        when(coordinator.status("docsearch", "nothing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/pipelines/docsearch/nothing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value(containsString("docsearch-nothing")));
    }

    @Test
    @DisplayName("history lists stored pipeline states")
    void history() throws Exception {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        when(coordinator.history()).thenReturn(List.of(
                PipelineState.started(PipelineFixtures.loginRequest(), now)));

        mockMvc.perform(get("/api/v1/pipelines"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].status").value("IN_PROGRESS"))
                .andExpect(jsonPath("$[0].request.feature").value("login"));
    }

    @Test
    @DisplayName("resume returns 404 when nothing is stored")
    void resumeNotFound() throws Exception {
        when(coordinator.status("docsearch", "login")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/pipelines/docsearch/login/resume"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("resume returns 409 when the pipeline is running")
    void resumeConflict() throws Exception {
        when(coordinator.status("docsearch", "login")).thenReturn(Optional.of(result(PipelineStatus.IN_PROGRESS)));
        when(coordinator.isRunning("docsearch", "login")).thenReturn(true);

        mockMvc.perform(post("/api/v1/pipelines/docsearch/login/resume"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("resume returns the stored result without rerunning a finished pipeline")
    void resumeFinishedPipeline() throws Exception {
        when(coordinator.status("docsearch", "login")).thenReturn(Optional.of(result(PipelineStatus.SUCCESS)));

        mockMvc.perform(post("/api/v1/pipelines/docsearch/login/resume"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.status").value("SUCCESS"));

        verify(coordinator, never()).resume(anyString(), anyString());
    }

    @Test
    @DisplayName("resume queues an interrupted pipeline and returns 202")
    void resumeInterruptedPipeline() throws Exception {
        when(coordinator.status("docsearch", "login")).thenReturn(Optional.of(result(PipelineStatus.IN_PROGRESS)));
        when(coordinator.isRunning("docsearch", "login")).thenReturn(false);
        when(coordinator.resume("docsearch", "login")).thenReturn(result(PipelineStatus.SUCCESS));

        mockMvc.perform(post("/api/v1/pipelines/docsearch/login/resume"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.request_id").value("GF-2026-TEST0001"));

        verify(coordinator).resume("docsearch", "login");
    }

    @Test
    @DisplayName("cancel returns 202 for a running pipeline")
    void cancelRunning() throws Exception {
        when(coordinator.cancel("docsearch", "login")).thenReturn(true);

        mockMvc.perform(post("/api/v1/pipelines/docsearch/login/cancel"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("cancelling"));
    }

    @Test
    @DisplayName("cancel returns 404 when nothing is running")
    void cancelIdle() throws Exception {
        when(coordinator.cancel("docsearch", "login")).thenReturn(false);

        mockMvc.perform(post("/api/v1/pipelines/docsearch/login/cancel"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("classify returns the classifier verdict without running anything")
    void classifyDryRun() throws Exception {
        classifyAs(PipelineFixtures.loginRequest());

        mockMvc.perform(post("/api/v1/pipelines/classify")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("Test login at https://docsearch.example.com/login"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pipelineRequest").value(true))
                .andExpect(jsonPath("$.request.domain").value("docsearch"));

        verify(coordinator, never()).run(any());
    }
}
