package com.lf2x.core;

import java.util.Map;
import java.util.Objects;

/** A node as declared in a parsed flow export. */
public record FlowNode(String nodeId, String type, Map<String, Object> data) {
    public FlowNode {
        nodeId = Objects.requireNonNull(nodeId, "nodeId");
        type = Objects.requireNonNull(type, "type");
        data = ConfigValues.copyOf(data);
    }
}
