package com.lf2x.config;

import com.lf2x.core.analysis.TargetRecommendation;

import java.util.Objects;

/** How well a flow component type converts, and which target handles it. {@code notes} may be null. */
public record ComponentMapping(String type, boolean supported, TargetRecommendation target, String notes) {
    public ComponentMapping {
        type = Objects.requireNonNull(type, "type");
        target = Objects.requireNonNull(target, "target");
    }
}
