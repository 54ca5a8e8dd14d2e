package com.lf2x.core.analysis;

import java.util.Objects;

/**
 * Classifier verdict. Both flags are kept even when the pattern already implies them.
 */
public record FlowAnalysis(
    FlowPattern pattern,
    TargetRecommendation recommendedTarget,
    boolean hasCycles,
    boolean hasBranching
) {
    public FlowAnalysis {
        pattern = Objects.requireNonNull(pattern, "pattern");
        recommendedTarget = Objects.requireNonNull(recommendedTarget, "recommendedTarget");
    }
}
