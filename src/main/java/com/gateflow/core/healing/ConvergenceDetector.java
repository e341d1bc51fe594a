package com.gateflow.core.healing;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Detects failure convergence: the two most recent execution runs of a pipeline failed
 * with exactly the same signature.
 * <p>
 * History is kept per pipeline key so concurrent runs of different features never see
 * each other's failures.
 */
@Service
public class ConvergenceDetector {

    private final ConcurrentHashMap<String, List<String>> failureHistory = new ConcurrentHashMap<>();

    public void recordFailure(String pipelineKey, String signature) {
        failureHistory.computeIfAbsent(pipelineKey, k -> new ArrayList<>()).add(signature);
    }

    public boolean isConverged(String pipelineKey) {
        var history = failureHistory.get(pipelineKey);
        if (history == null || history.size() < 2) {
            return false;
        }
        return history.get(history.size() - 1).equals(history.get(history.size() - 2));
    }

    public int failureCount(String pipelineKey) {
        var history = failureHistory.get(pipelineKey);
        return history != null ? history.size() : 0;
    }

    public void clearHistory(String pipelineKey) {
        failureHistory.remove(pipelineKey);
    }
}
