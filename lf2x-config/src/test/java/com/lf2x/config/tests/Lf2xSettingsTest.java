package com.lf2x.config.tests;

import com.lf2x.config.DanglingEdgePolicy;
import com.lf2x.config.Lf2xSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public final class Lf2xSettingsTest {

    @TempDir
    Path tmp;

    @Test
    void defaultsWithoutAnyConfigFile() throws Exception {
        Lf2xSettings settings = Lf2xSettings.builder().searchPaths(List.of(tmp)).build();

        assertEquals(Path.of("dist"), settings.outputDir());
        assertNull(settings.configFile());
        assertNull(settings.apiBaseUrl());
        assertNull(settings.apiToken());
        assertEquals(DanglingEdgePolicy.TOLERATE, settings.danglingEdgePolicy());
        assertEquals(Lf2xSettings.defaults(), settings);
    }

    @Test
    void explicitOutputDirWins() throws Exception {
        Files.writeString(tmp.resolve("lf2x.yaml"), "paths:\n  output_dir: from-config\n");

        Lf2xSettings settings = Lf2xSettings.builder()
            .outputDir(Path.of("explicit"))
            .searchPaths(List.of(tmp))
            .build();

        assertEquals(Path.of("explicit"), settings.outputDir());
        assertEquals(tmp.resolve("lf2x.yaml"), settings.configFile());
    }

    @Test
    void discoversConfigInSearchPathsInOrder() throws Exception {
        Path first = Files.createDirectory(tmp.resolve("first"));
        Path second = Files.createDirectory(tmp.resolve("second"));
        Files.writeString(second.resolve("lf2x.yaml"), "paths:\n  output_dir: second-out\n");

        Lf2xSettings settings = Lf2xSettings.builder().searchPaths(List.of(first, second)).build();

        assertEquals(Path.of("second-out"), settings.outputDir());
        assertEquals(second.resolve("lf2x.yaml"), settings.configFile());
    }

    @Test
    void explicitConfigFileIsReadInFull() throws Exception {
        Path config = tmp.resolve("custom.yaml");
        Files.writeString(config, """
            paths:
              output_dir: build/generated
            api:
              base_url: http://localhost:7860
              token: secret-token
            graph:
              dangling_edges: reject
            """);

        Lf2xSettings settings = Lf2xSettings.builder().configFile(config).build();

        assertEquals(Path.of("build/generated"), settings.outputDir());
        assertEquals(config, settings.configFile());
        assertEquals("http://localhost:7860", settings.apiBaseUrl());
        assertEquals("secret-token", settings.apiToken());
        assertEquals(DanglingEdgePolicy.REJECT, settings.danglingEdgePolicy());
    }

    @Test
    void emptyConfigFileFallsBackToDefaults() throws Exception {
        Path config = Files.writeString(tmp.resolve("lf2x.yaml"), "");

        Lf2xSettings settings = Lf2xSettings.builder().configFile(config).build();

        assertEquals(Lf2xSettings.DEFAULT_OUTPUT_DIR, settings.outputDir());
    }

    @Test
    void nonMappingConfigIsRejected() throws Exception {
        Path config = Files.writeString(tmp.resolve("lf2x.yaml"), "- just\n- a list\n");

        IOException exception = assertThrows(IOException.class,
            () -> Lf2xSettings.builder().configFile(config).build());

        assertTrue(exception.getMessage().endsWith("must contain a mapping"));
    }

    @Test
    void unknownDanglingPolicyIsRejected() throws Exception {
        Path config = Files.writeString(tmp.resolve("lf2x.yaml"), "graph:\n  dangling_edges: maybe\n");

        assertThrows(IOException.class, () -> Lf2xSettings.builder().configFile(config).build());
    }

    @Test
    void missingExplicitConfigFileFails() {
        assertThrows(IOException.class,
            () -> Lf2xSettings.builder().configFile(tmp.resolve("absent.yaml")).build());
    }

    @Test
    void resolvesRelativeOutputDirAgainstBase() {
        Lf2xSettings relative = Lf2xSettings.defaults();
        Lf2xSettings absolute = Lf2xSettings.defaults().withOverrides(tmp.resolve("abs"), null, null, null);

        assertEquals(tmp.resolve("dist"), relative.resolveOutputDir(tmp));
        assertEquals(tmp.resolve("abs"), absolute.resolveOutputDir(Path.of("/elsewhere")));
        assertFalse(Files.exists(tmp.resolve("dist")));
    }

    @Test
    void overridesOnlyReplaceNonNullValues() {
        Lf2xSettings base = Lf2xSettings.defaults().withOverrides(null, null, "http://a", "t1");

        Lf2xSettings overridden = base.withOverrides(Path.of("out"), null, null, "t2");

        assertEquals(Path.of("out"), overridden.outputDir());
        assertEquals("http://a", overridden.apiBaseUrl());
        assertEquals("t2", overridden.apiToken());
        assertEquals(DanglingEdgePolicy.TOLERATE, overridden.danglingEdgePolicy());
    }
}
