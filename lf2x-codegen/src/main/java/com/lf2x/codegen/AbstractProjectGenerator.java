package com.lf2x.codegen;

import com.lf2x.codegen.secrets.DetectedSecret;
import com.lf2x.codegen.secrets.SecretDetector;
import com.lf2x.config.ComponentMapping;
import com.lf2x.config.ComponentRegistry;
import com.lf2x.core.IntermediateRepresentation;
import com.lf2x.core.IrEdge;
import com.lf2x.core.IrNode;
import com.lf2x.core.analysis.FlowAnalysis;
import com.lf2x.core.analysis.FlowAnalyzer;
import com.lf2x.core.scaffold.GeneratedFile;
import com.lf2x.core.scaffold.ScaffoldWriter;
import com.lf2x.core.scaffold.WriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shared layout for the Python project generators: template context, secret detection and
 * notes for components the registry cannot convert.
 */
abstract class AbstractProjectGenerator implements ProjectGenerator {
    private static final Logger log = LoggerFactory.getLogger(AbstractProjectGenerator.class);

    private final ComponentRegistry registry;

    AbstractProjectGenerator(ComponentRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Template directory under {@code /templates}. */
    abstract String templateDir();

    /** Subclass-specific files, in write order. */
    abstract List<GeneratedFile> layout(IntermediateRepresentation ir, Map<String, Object> context) throws IOException;

    @Override
    public final List<GeneratedFile> files(IntermediateRepresentation ir) throws IOException {
        Objects.requireNonNull(ir, "ir");
        FlowAnalysis analysis = FlowAnalyzer.analyze(ir);
        if (!supports(analysis.pattern())) {
            throw new IllegalArgumentException(
                target().label() + " generator does not handle " + analysis.pattern() + " flows: " + ir.flowId());
        }
        return layout(ir, context(ir, SecretDetector.detect(ir)));
    }

    @Override
    public final GeneratedProject generate(IntermediateRepresentation ir, ScaffoldWriter writer) throws IOException {
        Objects.requireNonNull(writer, "writer");
        List<GeneratedFile> files = files(ir);
        List<WriteResult> writes = writer.write(files);
        log.debug("{} generator wrote {} file(s) for '{}' under {}", target().label(), writes.size(), ir.flowId(), writer.root());
        return new GeneratedProject(writer.root(), packageName(ir), ir.flowId(), target(), writes);
    }

    Map<String, Object> context(IntermediateRepresentation ir, List<DetectedSecret> secrets) {
        String packageName = packageName(ir);
        List<String> nodeIds = new ArrayList<>(ir.nodes().size());
        for (IrNode node : ir.nodes()) nodeIds.add(node.nodeId());

        List<Map<String, String>> edges = new ArrayList<>(ir.edges().size());
        for (IrEdge edge : ir.edges()) edges.add(Map.of("source", edge.source(), "target", edge.target()));

        List<Map<String, String>> secretRows = new ArrayList<>(secrets.size());
        for (DetectedSecret secret : secrets) {
            secretRows.add(Map.of(
                "envVar", secret.envVar(),
                "attribute", secret.attribute(),
                "sourceNode", secret.sourceNode(),
                "field", secret.field()));
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("flowId", ir.flowId());
        context.put("displayName", ir.name().isBlank() ? ir.flowId() : ir.name());
        context.put("packageName", packageName);
        context.put("projectName", packageName.replace('_', '-'));
        context.put("nodeIds", nodeIds);
        context.put("firstNodeId", nodeIds.isEmpty() ? "" : nodeIds.get(0));
        context.put("edges", edges);
        context.put("secrets", secretRows);
        return context;
    }

    GeneratedFile file(Path relativePath, String template, Map<String, Object> context, List<String> todos)
            throws IOException {
        return new GeneratedFile(relativePath, TemplateRenderer.render(template, context), todos);
    }

    String template(String name) {
        return templateDir() + "/" + name;
    }

    /** One note per node whose component type the registry marks unsupported or does not know. */
    List<String> componentNotes(IntermediateRepresentation ir) {
        List<String> notes = new ArrayList<>();
        for (IrNode node : ir.nodes()) {
            String type = componentType(node);
            if (registry.isSupported(type)) continue;
            String reason = registry.get(type)
                .map(ComponentMapping::notes)
                .filter(text -> text != null && !text.isBlank())
                .orElse(registry.get(type).isPresent() ? "not supported" : "unknown component type");
            notes.add("Provide an adapter for " + type + " node " + node.nodeId() + " (" + reason + ")");
        }
        return notes;
    }

    /** The inner {@code data.type} when present, else the node's own type tag. */
    static String componentType(IrNode node) {
        Object inner = node.data().get("type");
        if (inner instanceof String text && !text.isBlank()) return text;
        return node.type();
    }
}
