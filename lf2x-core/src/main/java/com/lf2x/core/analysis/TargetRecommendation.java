package com.lf2x.core.analysis;

/** Downstream code generation target suggested by the flow shape. */
public enum TargetRecommendation {
    /** Chain/pipeline target, for linear flows. */
    LANGCHAIN("langchain"),
    /** Graph execution target, for branching or cyclic flows. */
    LANGGRAPH("langgraph");

    private final String label;

    TargetRecommendation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static TargetRecommendation fromLabel(String label) {
        for (TargetRecommendation target : values()) {
            if (target.label.equalsIgnoreCase(label.strip())) return target;
        }
        throw new IllegalArgumentException("Unknown target: " + label);
    }
}
