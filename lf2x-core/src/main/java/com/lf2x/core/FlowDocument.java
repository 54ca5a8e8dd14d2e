package com.lf2x.core;

import java.util.List;
import java.util.Objects;

/**
 * Structured form of a flow export, as produced by the export loader.
 * Validation (required fields, shapes, schema version) has already happened when one of these exists.
 */
public record FlowDocument(
    String flowId,
    String name,
    String version,
    List<FlowNode> nodes,
    List<FlowEdge> edges,
    FlowMetadata metadata
) {
    public FlowDocument {
        flowId = Objects.requireNonNull(flowId, "flowId");
        name = Objects.requireNonNull(name, "name");
        version = Objects.requireNonNull(version, "version");
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        edges = List.copyOf(Objects.requireNonNull(edges, "edges"));
        metadata = Objects.requireNonNull(metadata, "metadata");
    }
}
