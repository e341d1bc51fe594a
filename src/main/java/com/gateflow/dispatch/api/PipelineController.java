package com.gateflow.dispatch.api;

import com.gateflow.core.classify.ClassificationResult;
import com.gateflow.core.classify.RequestClassifier;
import com.gateflow.core.engine.PipelineAlreadyRunningException;
import com.gateflow.core.engine.PipelineCoordinator;
import com.gateflow.core.engine.PipelineNotFoundException;
import com.gateflow.core.engine.RequestIds;
import com.gateflow.core.engine.RequestValidator;
import com.gateflow.core.model.PipelineRequest;
import com.gateflow.core.model.PipelineState;
import com.gateflow.core.model.PipelineStatus;
import com.gateflow.core.persistence.StateKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * REST controller for the pipeline lifecycle.
 * <p>
 * Submissions are classified and validated synchronously, so bad input gets a 400 and a key
 * that is already running gets a 409 before anything is queued. The run itself happens on
 * the bounded pipeline executor; callers poll {@code GET /api/v1/pipelines/{domain}/{feature}}.
 */
@RestController
@RequestMapping("/api/v1/pipelines")
public class PipelineController {

    private static final Logger log = LoggerFactory.getLogger(PipelineController.class);

    private final PipelineCoordinator coordinator;
    private final RequestClassifier classifier;
    private final Executor pipelineExecutor;

    public PipelineController(PipelineCoordinator coordinator, RequestClassifier classifier,
                              @Qualifier("pipelineExecutor") Executor pipelineExecutor) {
        this.coordinator = coordinator;
        this.classifier = classifier;
        this.pipelineExecutor = pipelineExecutor;
    }

    /**
     * POST /api/v1/pipelines: submit a request (JSON object or free text). Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<?> submit(@RequestBody String body) {
        ClassificationResult classification = classifier.classify(body);
        if (!classification.pipelineRequest()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", classification.reason(),
                    "missing", classification.missing()));
        }

        PipelineRequest request = classification.request().withRequestId(RequestIds.next());
        List<String> violations = RequestValidator.violations(request);
        if (!violations.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "invalid pipeline request",
                    "violations", violations));
        }
        if (coordinator.isRunning(request.domain(), request.feature())) {
            return conflict(request.domain(), request.feature());
        }

        try {
            pipelineExecutor.execute(() -> runSafely(request));
        } catch (RejectedExecutionException e) {
            log.warn("Rejected pipeline {}: executor is saturated", request.requestId());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "too many pipelines queued, retry later"));
        }
        log.info("Accepted pipeline {} for {}/{}", request.requestId(), request.domain(), request.feature());
        return accepted(request.requestId(), request.domain(), request.feature());
    }

    /**
     * GET /api/v1/pipelines: stored pipelines, ordered by key.
     */
    @GetMapping
    public List<PipelineState> list() {
        return coordinator.history();
    }

    @GetMapping("/{domain}/{feature}")
    public ResponseEntity<?> status(@PathVariable String domain, @PathVariable String feature) {
        return coordinator.status(domain, feature)
                .<ResponseEntity<?>>map(result -> ResponseEntity.ok(
                        new PipelineStatusResponse(coordinator.isRunning(domain, feature), result)))
                .orElseGet(() -> notFound(domain, feature));
    }

    @PostMapping("/{domain}/{feature}/resume")
    public ResponseEntity<?> resume(@PathVariable String domain, @PathVariable String feature) {
        var stored = coordinator.status(domain, feature);
        if (stored.isEmpty()) {
            return notFound(domain, feature);
        }
        if (coordinator.isRunning(domain, feature)) {
            return conflict(domain, feature);
        }
        if (stored.get().status() != PipelineStatus.IN_PROGRESS) {
            return ResponseEntity.ok(new PipelineStatusResponse(false, stored.get()));
        }
        try {
            pipelineExecutor.execute(() -> resumeSafely(domain, feature));
        } catch (RejectedExecutionException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "too many pipelines queued, retry later"));
        }
        return accepted(stored.get().requestId(), domain, feature);
    }

    @PostMapping("/{domain}/{feature}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String domain, @PathVariable String feature) {
        if (!coordinator.cancel(domain, feature)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "no running pipeline " + StateKeys.prefix(domain, feature)));
        }
        return ResponseEntity.accepted().body(Map.of("status", "cancelling"));
    }

    /**
     * POST /api/v1/pipelines/classify: dry run of the classifier.
     */
    @PostMapping("/classify")
    public ClassificationResult classify(@RequestBody String body) {
        return classifier.classify(body);
    }

    private void runSafely(PipelineRequest request) {
        try {
            var result = coordinator.run(request);
            log.info("Pipeline {} finished: {}", request.requestId(), result.status());
        } catch (PipelineAlreadyRunningException e) {
            log.warn("Pipeline {} not started: {}", request.requestId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Pipeline {} failed", request.requestId(), e);
        }
    }

    private void resumeSafely(String domain, String feature) {
        try {
            var result = coordinator.resume(domain, feature);
            log.info("Resumed pipeline {}/{} finished: {}", domain, feature, result.status());
        } catch (PipelineAlreadyRunningException | PipelineNotFoundException e) {
            log.warn("Pipeline {}/{} not resumed: {}", domain, feature, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Resumed pipeline {}/{} failed", domain, feature, e);
        }
    }

    private static ResponseEntity<?> accepted(String requestId, String domain, String feature) {
        String d = StateKeys.slug(domain);
        String f = StateKeys.slug(feature);
        return ResponseEntity.accepted()
                .location(URI.create("/api/v1/pipelines/" + d + "/" + f))
                .body(new PipelineAccepted(requestId, StateKeys.pipeline(domain, feature), d, f,
                        PipelineStatus.IN_PROGRESS.name()));
    }

    private static ResponseEntity<?> conflict(String domain, String feature) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", "pipeline " + StateKeys.prefix(domain, feature) + " is already running"));
    }

    private static ResponseEntity<?> notFound(String domain, String feature) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "pipeline " + StateKeys.prefix(domain, feature) + " not found"));
    }
}
