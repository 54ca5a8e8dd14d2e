package com.lf2x.core;

import java.util.Map;
import java.util.Objects;

public record IrNode(String nodeId, String type, Map<String, Object> data) {
    public IrNode {
        nodeId = Objects.requireNonNull(nodeId, "nodeId");
        type = Objects.requireNonNull(type, "type");
        data = ConfigValues.copyOf(data);
    }
}
