package com.lf2x.config;

import com.lf2x.core.FlowEdge;
import com.lf2x.core.FlowNode;

import java.util.List;
import java.util.Objects;

/** Top-level fields of a flow export after shape validation, before version and metadata resolution. */
public record FlowExport(
    String flowId,
    String name,
    String description,
    List<String> tags,
    String version,
    List<FlowNode> nodes,
    List<FlowEdge> edges
) {
    public FlowExport {
        flowId = Objects.requireNonNull(flowId, "flowId");
        name = Objects.requireNonNull(name, "name");
        tags = List.copyOf(Objects.requireNonNull(tags, "tags"));
        version = Objects.requireNonNull(version, "version");
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        edges = List.copyOf(Objects.requireNonNull(edges, "edges"));
    }
}
