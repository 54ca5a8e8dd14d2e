package com.lf2x.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Normalized, immutable flow graph shared by the analyzer and the generators.
 * Node and edge order is the declaration order of the export.
 */
public record IntermediateRepresentation(
    String flowId,
    String name,
    String version,
    List<IrNode> nodes,
    List<IrEdge> edges,
    IrMetadata metadata
) {
    public IntermediateRepresentation {
        flowId = Objects.requireNonNull(flowId, "flowId");
        name = Objects.requireNonNull(name, "name");
        version = Objects.requireNonNull(version, "version");
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        edges = List.copyOf(Objects.requireNonNull(edges, "edges"));
        metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public Set<String> nodeIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (IrNode node : nodes) ids.add(node.nodeId());
        return Collections.unmodifiableSet(ids);
    }

    public Set<String> edgeIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (IrEdge edge : edges) ids.add(edge.edgeId());
        return Collections.unmodifiableSet(ids);
    }
}
