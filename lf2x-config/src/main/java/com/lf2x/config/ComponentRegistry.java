package com.lf2x.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.lf2x.core.analysis.TargetRecommendation;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry of known flow component types, loaded from a YAML list. {@code target} defaults to langchain.
 *
 * <pre>
 * - type: ChatInput
 *   supported: true
 *   target: langchain
 *   notes: optional free text
 * </pre>
 */
public final class ComponentRegistry {
    public static final String DEFAULT_RESOURCE = "/mappings/components.yaml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final Map<String, ComponentMapping> entries;

    private ComponentRegistry(Map<String, ComponentMapping> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static ComponentRegistry loadDefault() throws IOException {
        try (InputStream in = ComponentRegistry.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new IOException("Component registry resource not found: " + DEFAULT_RESOURCE);
            return load(in, DEFAULT_RESOURCE);
        }
    }

    public static ComponentRegistry load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        }
    }

    private static ComponentRegistry load(InputStream in, String origin) throws IOException {
        JsonNode root = YAML.readTree(in);
        if (root == null || !root.isArray()) {
            throw new IOException("Invalid component registry format in " + origin);
        }
        Map<String, ComponentMapping> entries = new LinkedHashMap<>();
        for (JsonNode item : root) {
            if (!item.isObject()) continue;
            String type = item.path("type").asText();
            String target = item.path("target").asText(TargetRecommendation.LANGCHAIN.label());
            TargetRecommendation recommendation;
            try {
                recommendation = TargetRecommendation.fromLabel(target);
            } catch (IllegalArgumentException exception) {
                throw new IOException("Invalid target '" + target + "' for component " + type + " in " + origin, exception);
            }
            JsonNode notes = item.get("notes");
            entries.put(type, new ComponentMapping(
                type,
                item.path("supported").asBoolean(false),
                recommendation,
                notes == null || notes.isNull() ? null : notes.asText()));
        }
        return new ComponentRegistry(entries);
    }

    public Optional<ComponentMapping> get(String componentType) {
        if (componentType == null) return Optional.empty();
        return Optional.ofNullable(entries.get(componentType.strip()));
    }

    public boolean isSupported(String componentType) {
        return get(componentType).map(ComponentMapping::supported).orElse(false);
    }

    public Optional<TargetRecommendation> suggestedTarget(String componentType) {
        return get(componentType).map(ComponentMapping::target);
    }

    public int size() {
        return entries.size();
    }
}
