package com.lf2x.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lf2x.core.FlowDocument;
import com.lf2x.core.FlowEdge;
import com.lf2x.core.FlowMetadata;
import com.lf2x.core.FlowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Parses flow export JSON into a {@link FlowDocument}.
 *
 * <p>Nodes and edges are read from the top level, falling back to the nested {@code data} block.
 * The schema version comes from {@code version} or {@code last_tested_version}.
 */
public final class FlowExportLoader {
    private static final Logger log = LoggerFactory.getLogger(FlowExportLoader.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> CONFIG_MAP = new TypeReference<>() {};

    public static final List<String> SUPPORTED_VERSIONS = List.of("1.0.0", "1.5.1");

    private FlowExportLoader() {}

    public static FlowDocument load(Path source) throws IOException {
        return load(source, Lf2xSettings.defaults());
    }

    public static FlowDocument load(Path source, Lf2xSettings settings) throws IOException {
        Objects.requireNonNull(source, "source");
        try (InputStream in = Files.newInputStream(source)) {
            return load(in, source, settings);
        }
    }

    public static FlowDocument load(InputStream in, Path sourcePath, Lf2xSettings settings) throws IOException {
        Objects.requireNonNull(in, "in");
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(in);
        } catch (JsonProcessingException exception) {
            throw new MalformedExportException("Flow export is not valid JSON: " + sourcePath, exception);
        }
        return fromTree(root, sourcePath, settings, SUPPORTED_VERSIONS);
    }

    /**
     * Builds a document from an already parsed tree.
     *
     * @param supportedVersions accepted schema versions; an empty list accepts any version
     */
    public static FlowDocument fromTree(
        JsonNode root,
        Path sourcePath,
        Lf2xSettings settings,
        List<String> supportedVersions
    ) throws IOException {
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(supportedVersions, "supportedVersions");

        FlowExport export = parseExport(root);
        if (!supportedVersions.isEmpty() && !supportedVersions.contains(export.version())) {
            throw new UnsupportedFlowVersionException(export.version(), supportedVersions);
        }
        if (settings.danglingEdgePolicy() == DanglingEdgePolicy.REJECT) {
            rejectDanglingEdges(export);
        }

        FlowMetadata metadata = new FlowMetadata(sourcePath, settings.resolveOutputDir());
        log.debug("loaded flow '{}' v{} from {}: {} node(s), {} edge(s)",
            export.flowId(), export.version(), sourcePath, export.nodes().size(), export.edges().size());
        return new FlowDocument(
            export.flowId(), export.name(), export.version(), export.nodes(), export.edges(), metadata);
    }

    /** Shape validation only: required fields, array and object types. No version check. */
    public static FlowExport parseExport(JsonNode root) throws IOException {
        if (root == null || !root.isObject()) {
            throw new MalformedExportException("Flow export must be a JSON object");
        }
        String flowId = requiredText(root, "id");
        String name = requiredText(root, "name");

        String version = optionalText(root, "version");
        if (version == null || version.isEmpty()) version = optionalText(root, "last_tested_version");
        if (version == null || version.isEmpty()) throw new MissingFieldException("version");

        JsonNode tagsNode = root.get("tags");
        List<String> tags = new ArrayList<>();
        if (tagsNode != null && !tagsNode.isNull()) {
            if (!tagsNode.isArray()) throw new MalformedExportException("'tags' must be a sequence if provided");
            for (JsonNode tag : tagsNode) tags.add(stringify(tag));
        }

        JsonNode nodesNode = graphSection(root, "nodes");
        JsonNode edgesNode = graphSection(root, "edges");

        List<FlowNode> nodes = new ArrayList<>(nodesNode.size());
        for (JsonNode nodeEntry : nodesNode) nodes.add(parseNode(nodeEntry));

        List<FlowEdge> edges = new ArrayList<>(edgesNode.size());
        for (JsonNode edgeEntry : edgesNode) edges.add(parseEdge(edgeEntry));

        return new FlowExport(flowId, name, optionalText(root, "description"), tags, version, nodes, edges);
    }

    private static FlowNode parseNode(JsonNode entry) throws IOException {
        if (entry == null || !entry.isObject()) throw new MalformedExportException("Each node must be a JSON object");
        String nodeId = requiredText(entry, "id");
        Map<String, Object> data = configMap(entry, "Node");

        String type = optionalText(entry, "type");
        if (type == null || type.isEmpty()) {
            Object innerType = data.get("type");
            type = innerType == null ? null : String.valueOf(innerType);
        }
        if (type == null || type.isEmpty()) {
            throw new MissingFieldException("type", "Node entries must include 'type': " + nodeId);
        }
        return new FlowNode(nodeId, type, data);
    }

    private static FlowEdge parseEdge(JsonNode entry) throws IOException {
        if (entry == null || !entry.isObject()) throw new MalformedExportException("Each edge must be a JSON object");
        return new FlowEdge(
            requiredText(entry, "id"),
            requiredText(entry, "source"),
            requiredText(entry, "target"),
            configMap(entry, "Edge")
        );
    }

    private static JsonNode graphSection(JsonNode root, String field) throws IOException {
        JsonNode section = root.get(field);
        if (section == null || section.isNull()) {
            JsonNode dataBlock = root.get("data");
            if (dataBlock != null && dataBlock.isObject()) section = dataBlock.get(field);
        }
        if (section == null || section.isNull()) throw new MissingFieldException(field);
        if (!section.isArray()) throw new MalformedExportException("'" + field + "' must be a list");
        return section;
    }

    private static Map<String, Object> configMap(JsonNode entry, String kind) throws IOException {
        JsonNode data = entry.get("data");
        if (data == null || data.isNull()) return Map.of();
        if (!data.isObject()) throw new MalformedExportException(kind + " 'data' must be a mapping if provided");
        return OBJECT_MAPPER.convertValue(data, CONFIG_MAP);
    }

    private static void rejectDanglingEdges(FlowExport export) throws DanglingEdgeException {
        Set<String> declared = new HashSet<>();
        for (FlowNode node : export.nodes()) declared.add(node.nodeId());
        for (FlowEdge edge : export.edges()) {
            if (!declared.contains(edge.source())) throw new DanglingEdgeException(edge.edgeId(), edge.source());
            if (!declared.contains(edge.target())) throw new DanglingEdgeException(edge.edgeId(), edge.target());
        }
    }

    private static String requiredText(JsonNode node, String field) throws MissingFieldException {
        String value = optionalText(node, field);
        if (value == null) throw new MissingFieldException(field);
        return value;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        return stringify(value);
    }

    private static String stringify(JsonNode value) {
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
