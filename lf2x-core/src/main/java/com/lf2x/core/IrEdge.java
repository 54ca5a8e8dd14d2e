package com.lf2x.core;

import java.util.Map;
import java.util.Objects;

public record IrEdge(String edgeId, String source, String target, Map<String, Object> data) {
    public IrEdge {
        edgeId = Objects.requireNonNull(edgeId, "edgeId");
        source = Objects.requireNonNull(source, "source");
        target = Objects.requireNonNull(target, "target");
        data = ConfigValues.copyOf(data);
    }
}
