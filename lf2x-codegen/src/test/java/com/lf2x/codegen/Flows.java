package com.lf2x.codegen;

import com.lf2x.core.FlowDocument;
import com.lf2x.core.FlowEdge;
import com.lf2x.core.FlowMetadata;
import com.lf2x.core.FlowNode;
import com.lf2x.core.IntermediateRepresentation;
import com.lf2x.core.IrBuilder;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Small in-memory flows for generator and converter tests. */
public final class Flows {
    private Flows() {}

    public static Path fixture(String name) throws URISyntaxException {
        return Path.of(Flows.class.getResource("/flows/" + name).toURI());
    }

    /** a -> b -> c ... with the given component types, ids {@code n0, n1, ...}. */
    public static FlowDocument chain(String flowId, String name, Path outputDir, String... types) {
        List<FlowNode> nodes = new ArrayList<>();
        List<FlowEdge> edges = new ArrayList<>();
        for (int i = 0; i < types.length; i++) {
            nodes.add(new FlowNode("n" + i, types[i], Map.of()));
            if (i > 0) edges.add(new FlowEdge("e" + i, "n" + (i - 1), "n" + i, Map.of()));
        }
        return new FlowDocument(flowId, name, "1.5.1", nodes, edges, new FlowMetadata(Path.of("inline.json"), outputDir));
    }

    public static IntermediateRepresentation linear(String flowId, String name) {
        return IrBuilder.build(chain(flowId, name, Path.of("dist"), "ChatInput", "Prompt", "ChatOutput"));
    }

    /** One source fanning out to two targets. */
    public static IntermediateRepresentation fanOut(String flowId, String name) {
        List<FlowNode> nodes = List.of(
            new FlowNode("in", "ChatInput", Map.of()),
            new FlowNode("left", "Prompt", Map.of()),
            new FlowNode("right", "URL", Map.of()));
        List<FlowEdge> edges = List.of(
            new FlowEdge("e1", "in", "left", Map.of()),
            new FlowEdge("e2", "in", "right", Map.of()));
        return IrBuilder.build(new FlowDocument(
            flowId, name, "1.5.1", nodes, edges, new FlowMetadata(Path.of("inline.json"), Path.of("dist"))));
    }
}
