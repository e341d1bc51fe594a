package com.gateflow.core.audit;

import com.gateflow.core.model.GateSummary;
import com.gateflow.core.model.PipelineStatus;
import com.gateflow.core.model.QualityMetrics;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Audit trail of one pipeline run, stored under {@code {domain}-{feature}-audit}.
 *
 * @param requestId        run the audit belongs to
 * @param pipelineKey      key of the pipeline record
 * @param status           terminal status assigned by the audit
 * @param qualityMetrics   metrics the status was derived from (embedded for reference)
 * @param requiredComplete whether every required gate completed
 * @param deliverables     artifact paths by category
 * @param gates            per-gate summaries in gate order
 * @param issues           reasons behind a non-SUCCESS status
 * @param auditedAt        when the audit ran
 */
public record AuditRecord(
    String requestId,
    String pipelineKey,
    PipelineStatus status,
    QualityMetrics qualityMetrics,
    boolean requiredComplete,
    Map<String, List<String>> deliverables,
    List<GateSummary> gates,
    List<String> issues,
    Instant auditedAt
) implements Serializable {

    public AuditRecord {
        deliverables = deliverables != null ? Map.copyOf(deliverables) : Map.of();
        gates = gates != null ? List.copyOf(gates) : List.of();
        issues = issues != null ? List.copyOf(issues) : List.of();
    }
}
