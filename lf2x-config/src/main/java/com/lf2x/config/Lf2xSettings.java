package com.lf2x.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Runtime preferences. Values resolve with the precedence explicit argument, then {@code lf2x.yaml},
 * then built-in default.
 *
 * <pre>
 * paths:
 *   output_dir: build/generated
 * api:
 *   base_url: http://localhost:7860
 *   token: secret
 * graph:
 *   dangling_edges: reject
 * </pre>
 */
public record Lf2xSettings(
    Path outputDir,
    Path configFile,
    String apiBaseUrl,
    String apiToken,
    DanglingEdgePolicy danglingEdgePolicy
) {
    public static final Path DEFAULT_OUTPUT_DIR = Path.of("dist");
    public static final String CONFIG_FILENAME = "lf2x.yaml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    public Lf2xSettings {
        outputDir = Objects.requireNonNull(outputDir, "outputDir");
        danglingEdgePolicy = Objects.requireNonNull(danglingEdgePolicy, "danglingEdgePolicy");
    }

    public static Lf2xSettings defaults() {
        return new Lf2xSettings(DEFAULT_OUTPUT_DIR, null, null, null, DanglingEdgePolicy.TOLERATE);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Absolute output directory, resolved against the working directory. Does not touch the filesystem. */
    public Path resolveOutputDir() {
        return resolveOutputDir(Path.of("").toAbsolutePath());
    }

    public Path resolveOutputDir(Path baseDir) {
        Objects.requireNonNull(baseDir, "baseDir");
        return outputDir.isAbsolute() ? outputDir : baseDir.resolve(outputDir);
    }

    /** A copy with the non-null arguments replacing the current values. */
    public Lf2xSettings withOverrides(Path outputDir, Path configFile, String apiBaseUrl, String apiToken) {
        return new Lf2xSettings(
            outputDir != null ? outputDir : this.outputDir,
            configFile != null ? configFile : this.configFile,
            apiBaseUrl != null ? apiBaseUrl : this.apiBaseUrl,
            apiToken != null ? apiToken : this.apiToken,
            danglingEdgePolicy
        );
    }

    public Lf2xSettings withDanglingEdgePolicy(DanglingEdgePolicy policy) {
        return new Lf2xSettings(outputDir, configFile, apiBaseUrl, apiToken, policy);
    }

    public static final class Builder {
        private Path outputDir;
        private Path configFile;
        private List<Path> searchPaths = List.of();
        private String apiBaseUrl;
        private String apiToken;
        private DanglingEdgePolicy danglingEdgePolicy;

        private Builder() {}

        public Builder outputDir(Path dir) { this.outputDir = dir; return this; }
        public Builder configFile(Path file) { this.configFile = file; return this; }
        public Builder searchPaths(List<Path> paths) { this.searchPaths = paths == null ? List.of() : List.copyOf(paths); return this; }
        public Builder apiBaseUrl(String url) { this.apiBaseUrl = url; return this; }
        public Builder apiToken(String token) { this.apiToken = token; return this; }
        public Builder danglingEdgePolicy(DanglingEdgePolicy policy) { this.danglingEdgePolicy = policy; return this; }

        /** Locates and reads the config file, then applies precedence. */
        public Lf2xSettings build() throws IOException {
            Path resolvedConfig = selectConfigPath();
            JsonNode config = resolvedConfig == null ? YAML.createObjectNode() : readConfig(resolvedConfig);

            Path resolvedOutputDir = outputDir;
            if (resolvedOutputDir == null) {
                String configured = text(config.path("paths").get("output_dir"));
                resolvedOutputDir = configured != null ? Path.of(configured) : DEFAULT_OUTPUT_DIR;
            }

            DanglingEdgePolicy policy = danglingEdgePolicy;
            if (policy == null) {
                String configured = text(config.path("graph").get("dangling_edges"));
                policy = configured != null ? DanglingEdgePolicy.parse(configured) : DanglingEdgePolicy.TOLERATE;
            }

            return new Lf2xSettings(
                resolvedOutputDir,
                resolvedConfig,
                apiBaseUrl != null ? apiBaseUrl : text(config.path("api").get("base_url")),
                apiToken != null ? apiToken : text(config.path("api").get("token")),
                policy
            );
        }

        private Path selectConfigPath() {
            if (configFile != null) return configFile;
            for (Path location : searchPaths) {
                Path candidate = location.resolve(CONFIG_FILENAME);
                if (Files.exists(candidate)) return candidate;
            }
            return null;
        }

        private static JsonNode readConfig(Path configPath) throws IOException {
            JsonNode root;
            try (InputStream in = Files.newInputStream(configPath)) {
                root = YAML.readTree(in);
            } catch (JsonProcessingException exception) {
                throw new IOException("Failed to parse configuration file " + configPath, exception);
            }
            if (root == null || root.isMissingNode() || root.isNull()) return YAML.createObjectNode();
            if (!root.isObject()) {
                throw new IOException("Configuration file " + configPath + " must contain a mapping");
            }
            return root;
        }

        private static String text(JsonNode node) {
            if (node == null || node.isNull() || node.isContainerNode()) return null;
            return node.asText();
        }
    }
}
