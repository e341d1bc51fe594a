package com.gateflow.core.model;

import java.util.Arrays;
import java.util.List;

/**
 * The six pipeline gates in canonical order.
 * <p>
 * Each gate is fulfilled by one external worker. {@link #DATA_PREPARATION} is conditional;
 * every other gate always runs unless an earlier gate fails.
 */
public enum Gate {
    DATA_PREPARATION(0, "data-preparer", "data", "dataFile"),
    TEST_CASE_DESIGN(1, "test-case-designer", null, null),
    ELEMENT_MAPPING(2, "element-mapper", "pageObjects", "pageObjectFile"),
    CODE_GENERATION(3, "code-generator", "tests", "testFiles"),
    EXECUTION(4, "test-executor", null, null),
    LEARNING_CAPTURE(5, "learning-recorder", "learnings", "learningFile");

    private final int index;
    private final String workerName;
    private final String deliverableCategory;
    private final String deliverableField;

    Gate(int index, String workerName, String deliverableCategory, String deliverableField) {
        this.index = index;
        this.workerName = workerName;
        this.deliverableCategory = deliverableCategory;
        this.deliverableField = deliverableField;
    }

    public int index() { return index; }
    public String workerName() { return workerName; }

    /** Graph node id for this gate, e.g. {@code gate_2}. */
    public String nodeId() { return "gate_" + index; }

    /** Category under which this gate's artifacts are reported, or null if it produces none. */
    public String deliverableCategory() { return deliverableCategory; }

    /** Output field holding the artifact path(s), or null if the gate produces none. */
    public String deliverableField() { return deliverableField; }

    public boolean producesDeliverable() { return deliverableField != null; }

    /** Deliverables the final audit insists on. Learning files are reported but not required. */
    public boolean requiresDeliverable() {
        return producesDeliverable() && this != LEARNING_CAPTURE;
    }

    /**
     * Predecessors whose durable result must exist before this gate may run.
     */
    public List<Gate> requiredPredecessors() {
        return switch (this) {
            case DATA_PREPARATION, TEST_CASE_DESIGN -> List.of();
            case ELEMENT_MAPPING -> List.of(TEST_CASE_DESIGN);
            case CODE_GENERATION -> List.of(TEST_CASE_DESIGN, ELEMENT_MAPPING);
            case EXECUTION -> List.of(TEST_CASE_DESIGN, CODE_GENERATION);
            case LEARNING_CAPTURE -> List.of(TEST_CASE_DESIGN, ELEMENT_MAPPING, CODE_GENERATION, EXECUTION);
        };
    }

    /**
     * Predecessors consumed when present. Only the conditional data preparation gate is optional.
     */
    public List<Gate> optionalPredecessors() {
        return switch (this) {
            case TEST_CASE_DESIGN, CODE_GENERATION, LEARNING_CAPTURE -> List.of(DATA_PREPARATION);
            default -> List.of();
        };
    }

    /** Whether the worker for this gate receives the cached page content. */
    public boolean usesPageContent() {
        return this == DATA_PREPARATION || this == TEST_CASE_DESIGN
                || this == ELEMENT_MAPPING || this == CODE_GENERATION;
    }

    public Gate next() {
        return this == LEARNING_CAPTURE ? null : of(index + 1);
    }

    public static Gate of(int index) {
        return Arrays.stream(values())
                .filter(g -> g.index == index)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No gate with index " + index));
    }
}
