package com.gateflow.core.healing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gateflow.core.GateflowProperties;
import com.gateflow.core.events.EventBus;
import com.gateflow.core.events.PipelineEvent;
import com.gateflow.core.gate.GateContext;
import com.gateflow.core.gate.GateExecutor;
import com.gateflow.core.logging.MdcContext;
import com.gateflow.core.metrics.GateflowMetrics;
import com.gateflow.core.model.Gate;
import com.gateflow.core.model.GateResult;
import com.gateflow.core.model.GateStatus;
import com.gateflow.core.model.HealingAttempt;
import com.gateflow.core.model.HealingOutcome;
import com.gateflow.core.model.HealingReport;
import com.gateflow.core.model.RunOutcome;
import com.gateflow.core.persistence.DurableWrites;
import com.gateflow.core.persistence.StateCodec;
import com.gateflow.core.persistence.StateKeys;
import com.gateflow.core.validation.GateProfiles;
import com.gateflow.core.validation.UpstreamArtifacts;
import com.gateflow.worker.WorkerInvocationException;
import com.gateflow.worker.WorkerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the execution gate repeatedly and interleaves bounded healing attempts.
 * <p>
 * Algorithm, per run:
 * <ol>
 *   <li>Invoke the executor worker and record {passed, failure signature}.</li>
 *   <li>A passing run ends the loop.</li>
 *   <li>If the two most recent runs failed with identical signatures and attempts remain,
 *       invoke {@value #HEALER_WORKER} and record a {@link HealingAttempt}; the next run
 *       verifies the fix.</li>
 *   <li>A FAILED healing attempt that uses up the last attempt ends the loop.</li>
 * </ol>
 * Runs with differing signatures never trigger healing. An invoker-level fault of the executor
 * worker ends the loop at once and fails the gate; a fault of the healer counts as a FAILED
 * attempt. Both {@code maxRuns} and {@code maxHealingAttempts} bound the loop.
 */
@Service
public class HealingLoop {

    private static final Logger log = LoggerFactory.getLogger(HealingLoop.class);

    public static final String HEALER_WORKER = "test-healer";

    private final GateExecutor executor;
    private final ConvergenceDetector convergenceDetector;
    private final DurableWrites writes;
    private final GateflowProperties properties;
    private final GateflowMetrics metrics;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper = StateCodec.objectMapper();

    public HealingLoop(GateExecutor executor, ConvergenceDetector convergenceDetector, DurableWrites writes,
                       GateflowProperties properties, GateflowMetrics metrics, EventBus eventBus) {
        this.executor = executor;
        this.convergenceDetector = convergenceDetector;
        this.writes = writes;
        this.properties = properties;
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    /**
     * Runs the loop, persists the final gate result (required) and the healing report
     * (auxiliary), and returns both.
     */
    public ExecutionOutcome execute(GateContext context) {
        Gate gate = Gate.EXECUTION;
        UpstreamArtifacts upstream = executor.loadUpstream(gate, context);
        String pipelineKey = context.pipelineKey();
        int maxRuns = Math.max(1, properties.getMaxRuns());
        int maxAttempts = Math.max(0, properties.getMaxHealingAttempts());

        List<RunOutcome> runs = new ArrayList<>();
        List<HealingAttempt> attempts = new ArrayList<>();
        GateResult last = null;
        boolean passed = false;
        boolean invokerFault = false;
        long start = System.currentTimeMillis();

        convergenceDetector.clearHistory(pipelineKey);
        try {
            for (int run = 1; run <= maxRuns; run++) {
                MdcContext.setRun(run);
                ObjectNode runFields = objectMapper.createObjectNode();
                runFields.put("runNumber", run);
                runFields.put("maxRuns", maxRuns);
                last = executor.evaluate(gate, context, upstream, runFields);

                if (isInvocationFault(last)) {
                    log.warn("Execution run {} could not be invoked; stopping: {}", run, last.validation().issues());
                    invokerFault = true;
                    break;
                }

                boolean runPassed = runPassed(last);
                String signature = runPassed ? null : signatureOf(last);
                double passRate = last.hasOutput() ? GateProfiles.passRate(last.output()) : 0.0;
                runs.add(new RunOutcome(run, runPassed, signature, (int) Math.round(passRate)));
                metrics.recordExecutionRun(runPassed);
                publish(context, PipelineEvent.EXECUTION_RUN, Map.of(
                        "run", run, "passed", runPassed, "passRate", passRate));
                log.info("Execution run {}/{}: {} (pass rate {})", run, maxRuns,
                        runPassed ? "passed" : "failed", Math.round(passRate));

                if (runPassed) {
                    passed = true;
                    break;
                }

                convergenceDetector.recordFailure(pipelineKey, signature);
                if (!convergenceDetector.isConverged(pipelineKey)) {
                    continue;
                }
                if (attempts.size() >= maxAttempts) {
                    log.info("Failure repeated but all {} healing attempt(s) are used; stopping", maxAttempts);
                    break;
                }
                if (run == maxRuns) {
                    log.info("Failure repeated on the last allowed run; no run left to verify a fix");
                    break;
                }

                HealingAttempt attempt = heal(attempts.size() + 1, maxAttempts, signature, last, context, upstream);
                attempts.add(attempt);
                if (attempt.outcome() == HealingOutcome.FAILED && attempts.size() >= maxAttempts) {
                    log.info("Healing attempt {} failed and no attempts remain; stopping", attempt.attemptNumber());
                    break;
                }
            }
        } finally {
            convergenceDetector.clearHistory(pipelineKey);
            MdcContext.clearRun();
        }

        var report = new HealingReport(runs, attempts, passed && !attempts.isEmpty(), !passed && !invokerFault);
        GateResult result = finalResult(last, passed, System.currentTimeMillis() - start);

        executor.persist(result, context);
        if (!writes.writeAuxiliary(StateKeys.healing(context.domain(), context.feature()), report)) {
            metrics.incrementAuxiliaryWriteFailures("healing");
        }
        return new ExecutionOutcome(result, report);
    }

    private HealingAttempt heal(int attemptNumber, int maxAttempts, String signature, GateResult failingRun,
                                GateContext context, UpstreamArtifacts upstream) {
        ObjectNode fields = objectMapper.createObjectNode();
        fields.put("attemptNumber", attemptNumber);
        fields.put("maxAttempts", maxAttempts);
        fields.put("failureSignature", signature);
        if (failingRun.hasOutput()) {
            fields.set("failingRun", failingRun.output());
        } else {
            fields.set("failingIssues", objectMapper.valueToTree(failingRun.validation().issues()));
        }

        HealingAttempt attempt;
        try {
            WorkerResponse response = executor.invoke(Gate.EXECUTION, HEALER_WORKER, context, upstream, fields);
            HealingOutcome outcome = response.isFailed() ? HealingOutcome.FAILED : HealingOutcome.SUCCESS;
            attempt = new HealingAttempt(attemptNumber, signature, outcome, summary(response));
        } catch (WorkerInvocationException e) {
            log.warn("Healing attempt {} could not be invoked: {}", attemptNumber, e.getMessage());
            attempt = new HealingAttempt(attemptNumber, signature, HealingOutcome.FAILED,
                    GateExecutor.INVOCATION_FAILURE + e.getMessage());
        }

        metrics.recordHealingAttempt(attempt.outcome().name());
        publish(context, PipelineEvent.HEALING_ATTEMPTED, Map.of(
                "attempt", attemptNumber, "outcome", attempt.outcome().name()));
        log.info("Healing attempt {}/{}: {}", attemptNumber, maxAttempts, attempt.outcome());
        return attempt;
    }

    /**
     * The last run decides the gate. A suite that never fully passed is capped at PARTIAL.
     */
    private GateResult finalResult(GateResult last, boolean passed, long durationMs) {
        GateStatus status = last.status();
        if (!passed && status == GateStatus.SUCCESS) {
            status = GateStatus.PARTIAL;
        }
        return new GateResult(last.gate(), last.workerName(), status, last.output(), last.validation(),
                durationMs, last.completedAt());
    }

    static boolean isInvocationFault(GateResult result) {
        return !result.hasOutput() && result.validation().issues().stream()
                .anyMatch(issue -> issue.startsWith(GateExecutor.INVOCATION_FAILURE));
    }

    /**
     * A worker that reports FAILED without a report is fingerprinted by its issues.
     */
    static String signatureOf(GateResult result) {
        if (result.hasOutput()) {
            return FailureSignature.of(result.output());
        }
        return FailureSignature.of(String.join("\n", result.validation().issues()), List.of());
    }

    static boolean runPassed(GateResult result) {
        if (!result.hasOutput() || !result.validation().passed()) {
            return false;
        }
        JsonNode output = result.output();
        return output.path("total").asInt(0) >= 1 && output.path("failed").asInt(1) == 0;
    }

    private static String summary(WorkerResponse response) {
        if (response.hasOutput() && response.output().hasNonNull("summary")) {
            return response.output().get("summary").asText();
        }
        List<String> issues = response.reportedIssues();
        return issues.isEmpty() ? response.status() : String.join("; ", issues);
    }

    private void publish(GateContext context, String type, Map<String, Object> payload) {
        eventBus.publish(PipelineEvent.of(type, context.request().requestId(), context.pipelineKey(),
                Gate.EXECUTION.index(), payload));
    }
}
