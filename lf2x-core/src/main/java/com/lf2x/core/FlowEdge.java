package com.lf2x.core;

import java.util.Map;
import java.util.Objects;

/** A directed edge as declared in a parsed flow export. Endpoints are not checked against the node set. */
public record FlowEdge(String edgeId, String source, String target, Map<String, Object> data) {
    public FlowEdge {
        edgeId = Objects.requireNonNull(edgeId, "edgeId");
        source = Objects.requireNonNull(source, "source");
        target = Objects.requireNonNull(target, "target");
        data = ConfigValues.copyOf(data);
    }
}
