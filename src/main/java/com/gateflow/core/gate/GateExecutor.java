package com.gateflow.core.gate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gateflow.core.GateflowProperties;
import com.gateflow.core.model.Gate;
import com.gateflow.core.model.GateResult;
import com.gateflow.core.model.GateStatus;
import com.gateflow.core.model.ValidationResult;
import com.gateflow.core.persistence.DurableWrites;
import com.gateflow.core.persistence.StateCodec;
import com.gateflow.core.persistence.StateKeys;
import com.gateflow.core.validation.UpstreamArtifacts;
import com.gateflow.core.validation.ValidationEngine;
import com.gateflow.worker.WorkerInvocationException;
import com.gateflow.worker.WorkerInvoker;
import com.gateflow.worker.WorkerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one gate: load upstream records, invoke the worker, validate, persist.
 * <p>
 * The result is durable before {@link #execute} returns. Invocation failures never escape
 * as exceptions; they become a FAILED result with an {@code invocation failure} issue and
 * no output.
 */
@Service
public class GateExecutor {

    private static final Logger log = LoggerFactory.getLogger(GateExecutor.class);

    public static final String INVOCATION_FAILURE = "invocation failure: ";

    private final DurableWrites writes;
    private final WorkerInvoker workerInvoker;
    private final ValidationEngine validationEngine;
    private final GateflowProperties properties;
    private final ObjectMapper objectMapper = StateCodec.objectMapper();

    public GateExecutor(DurableWrites writes, WorkerInvoker workerInvoker,
                        ValidationEngine validationEngine, GateflowProperties properties) {
        this.writes = writes;
        this.workerInvoker = workerInvoker;
        this.validationEngine = validationEngine;
        this.properties = properties;
    }

    public GateResult execute(Gate gate, GateContext context) {
        UpstreamArtifacts upstream = loadUpstream(gate, context);
        GateResult result = evaluate(gate, context, upstream, null);
        persist(result, context);
        return result;
    }

    /**
     * Loads the outputs this gate consumes.
     *
     * @throws GateContractViolation if a required predecessor has no durable result
     */
    public UpstreamArtifacts loadUpstream(Gate gate, GateContext context) {
        Map<Gate, JsonNode> outputs = new EnumMap<>(Gate.class);
        for (Gate predecessor : gate.requiredPredecessors()) {
            String key = StateKeys.gateOutput(context.domain(), context.feature(), predecessor);
            GateResult result = loadResult(key)
                    .orElseThrow(() -> new GateContractViolation(gate, predecessor, key));
            if (result.hasOutput()) {
                outputs.put(predecessor, result.output());
            }
        }
        for (Gate predecessor : gate.optionalPredecessors()) {
            String key = StateKeys.gateOutput(context.domain(), context.feature(), predecessor);
            loadResult(key).filter(GateResult::hasOutput)
                    .ifPresent(result -> outputs.put(predecessor, result.output()));
        }
        return new UpstreamArtifacts(context.request(), outputs);
    }

    /**
     * Invokes the worker and validates its answer without persisting anything.
     */
    public GateResult evaluate(Gate gate, GateContext context, UpstreamArtifacts upstream, ObjectNode extraFields) {
        long start = System.currentTimeMillis();
        WorkerResponse response;
        try {
            response = invoke(gate, gate.workerName(), context, upstream, extraFields);
        } catch (WorkerInvocationException e) {
            log.warn("Gate {} ({}) invocation failed: {}", gate.index(), gate.workerName(), e.getMessage());
            return new GateResult(gate.index(), gate.workerName(), GateStatus.FAILED, null,
                    ValidationResult.failure(INVOCATION_FAILURE + e.getMessage()),
                    System.currentTimeMillis() - start, Instant.now());
        }
        return judge(gate, response, upstream, System.currentTimeMillis() - start);
    }

    /**
     * Calls a worker on behalf of a gate with the configured timeout for that worker.
     *
     * @throws WorkerInvocationException on any invoker-level fault
     */
    public WorkerResponse invoke(Gate gate, String worker, GateContext context,
                                 UpstreamArtifacts upstream, ObjectNode extraFields) {
        var request = GateInputs.request(gate, worker, context, upstream, extraFields, objectMapper);
        var timeout = Duration.ofSeconds(properties.timeoutSecondsFor(worker));
        log.info("Invoking {} for gate {} (timeout {}s)", worker, gate.index(), timeout.toSeconds());
        return workerInvoker.invoke(request, timeout);
    }

    /**
     * Maps a worker answer to a gate result.
     * <p>
     * A worker-reported FAILED is final. Otherwise the independent validation decides, and a
     * worker that judged its own output PARTIAL is never promoted to SUCCESS.
     */
    public GateResult judge(Gate gate, WorkerResponse response, UpstreamArtifacts upstream, long durationMs) {
        if (response.isFailed()) {
            List<String> issues = new ArrayList<>(response.reportedIssues());
            if (issues.isEmpty()) {
                issues.add(gate.workerName() + " reported FAILED");
            }
            int score = response.hasOutput()
                    ? validationEngine.validate(gate, response.output(), upstream).score() : 0;
            return new GateResult(gate.index(), gate.workerName(), GateStatus.FAILED,
                    response.hasOutput() ? response.output() : null,
                    new ValidationResult(score, issues, false), durationMs, Instant.now());
        }

        ValidationResult validation = validationEngine.validate(gate, response.output(), upstream);
        GateStatus status = statusFor(validation);
        if (status == GateStatus.SUCCESS && WorkerResponse.PARTIAL.equals(response.status())) {
            status = GateStatus.PARTIAL;
        }
        return new GateResult(gate.index(), gate.workerName(), status, response.output(), validation,
                durationMs, Instant.now());
    }

    /**
     * {@code passed && score ≥ pass threshold → SUCCESS}, {@code passed && score ≥ partial
     * threshold → PARTIAL}, everything else FAILED.
     */
    public GateStatus statusFor(ValidationResult validation) {
        if (!validation.passed()) {
            return GateStatus.FAILED;
        }
        if (validation.score() >= properties.getPassThreshold()) {
            return GateStatus.SUCCESS;
        }
        if (validation.score() >= properties.getPartialThreshold()) {
            return GateStatus.PARTIAL;
        }
        return GateStatus.FAILED;
    }

    /**
     * Writes the result under its gate key. Required: a second failure propagates.
     */
    public void persist(GateResult result, GateContext context) {
        String key = StateKeys.gateOutput(context.domain(), context.feature(), result.gateType());
        writes.writeRequired(key, result);
        log.info("Gate {} {} (score {}, {} issue(s)) -> {}", result.gate(), result.status(),
                result.validation().score(), result.validation().issues().size(), key);
    }

    public Optional<GateResult> loadResult(Gate gate, GateContext context) {
        return loadResult(StateKeys.gateOutput(context.domain(), context.feature(), gate));
    }

    /**
     * Every durable gate result of a pipeline, keyed by gate.
     */
    public Map<Gate, GateResult> loadResults(String domain, String feature) {
        Map<Gate, GateResult> results = new EnumMap<>(Gate.class);
        for (Gate gate : Gate.values()) {
            loadResult(StateKeys.gateOutput(domain, feature, gate)).ifPresent(r -> results.put(gate, r));
        }
        return results;
    }

    private Optional<GateResult> loadResult(String key) {
        return writes.store().read(key, GateResult.class);
    }
}
