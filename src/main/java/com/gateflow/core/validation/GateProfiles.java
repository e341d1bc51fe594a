package com.gateflow.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.gateflow.core.model.Gate;

import java.util.EnumMap;
import java.util.Map;

/**
 * Registry of the validation profile for each gate, plus the gate quality measures the
 * final audit reuses.
 */
public final class GateProfiles {

    private static final Map<Gate, ValidationProfile> PROFILES = new EnumMap<>(Gate.class);

    static {
        register(new DataPreparationProfile());
        register(new TestCaseDesignProfile());
        register(new ElementMappingProfile());
        register(new CodeGenerationProfile());
        register(new ExecutionProfile());
        register(new LearningCaptureProfile());
    }

    private GateProfiles() {}

    private static void register(ValidationProfile profile) {
        PROFILES.put(profile.gate(), profile);
    }

    public static ValidationProfile forGate(Gate gate) {
        return PROFILES.get(gate);
    }

    /** Share of acceptance criteria referenced by the test case design, in [0, 100]. */
    public static double coverage(JsonNode testCaseDesign, UpstreamArtifacts upstream) {
        return PROFILES.get(Gate.TEST_CASE_DESIGN).quality(testCaseDesign, upstream);
    }

    /** Mean locator confidence of an element mapping output, in [0, 100]. */
    public static double locatorConfidence(JsonNode elementMapping) {
        return ElementMappingProfile.meanConfidence(elementMapping);
    }

    /** Pass rate of an execution report, in [0, 100]. */
    public static double passRate(JsonNode execution) {
        return ExecutionProfile.passRate(execution);
    }
}
