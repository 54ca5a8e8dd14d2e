package com.lf2x.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Builds the intermediate representation from a parsed document. Pure; never fails on a valid document. */
public final class IrBuilder {
    private IrBuilder() {}

    public static IntermediateRepresentation build(FlowDocument document) {
        Objects.requireNonNull(document, "document");

        List<IrNode> nodes = new ArrayList<>(document.nodes().size());
        for (FlowNode node : document.nodes()) {
            nodes.add(new IrNode(node.nodeId(), node.type(), node.data()));
        }

        List<IrEdge> edges = new ArrayList<>(document.edges().size());
        for (FlowEdge edge : document.edges()) {
            edges.add(new IrEdge(edge.edgeId(), edge.source(), edge.target(), edge.data()));
        }

        FlowMetadata metadata = document.metadata();
        return new IntermediateRepresentation(
            document.flowId(),
            document.name(),
            document.version(),
            nodes,
            edges,
            new IrMetadata(metadata.sourcePath(), metadata.outputDir())
        );
    }
}
