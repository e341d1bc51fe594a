package com.gateflow.core.model;

import java.io.Serializable;

/**
 * Quality figures derived from the gate results during the final audit.
 *
 * @param coverage          share of acceptance criteria covered by designed test cases (0-100)
 * @param locatorConfidence mean element-mapping confidence (0-100)
 * @param compiles          true when code generation reported zero compilation errors
 * @param passRate          pass rate of the final execution run (0-100)
 * @param overallScore      equally weighted combination of the four figures
 */
public record QualityMetrics(
    int coverage,
    int locatorConfidence,
    boolean compiles,
    int passRate,
    int overallScore
) implements Serializable {

    public static QualityMetrics none() {
        return new QualityMetrics(0, 0, false, 0, 0);
    }
}
