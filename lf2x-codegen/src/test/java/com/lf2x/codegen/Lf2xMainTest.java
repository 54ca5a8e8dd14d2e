package com.lf2x.codegen;

import com.lf2x.metrics.Metrics;
import com.lf2x.metrics.SimpleMetricsRecorder;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class Lf2xMainTest {
    private static final String SLUG = "b94bc279_989c_42bb_95ec_6baea451549a";

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void setup() throws Exception {
        Metrics.setRecorder(new SimpleMetricsRecorder());
        Files.copy(Flows.fixture("simple_passthrough.json"), tmp.resolve("flow.json"));
    }

    @Test
    void printsVersion() {
        assertEquals(0, run("version"));
        assertEquals(Lf2xMain.VERSION, stdout().strip());
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(2, run());
        assertEquals(2, run("explode"));
        assertTrue(stderr().contains("Unknown command: explode"));
        assertEquals(2, run("configure", "--bogus"));
        assertEquals(2, run("configure", "--output-dir"));
        assertEquals(2, run("convert"));
        assertEquals(2, run("convert", "a.json", "b.json"));
        assertEquals(2, run("convert", "--flow-id", "abc"));
        assertTrue(stderr().contains("--api-url or api.base_url in lf2x.yaml is required"));
        assertEquals(2, run("list-flows", "--api-url", "http://127.0.0.1:1", "--page-size", "0"));
    }

    @Test
    void runtimeFailuresExitWithOne() {
        assertEquals(1, execute(() -> {
            throw new IllegalStateException("Failed to render template 'langchain/cli.py'");
        }));
        assertEquals("Error: Failed to render template 'langchain/cli.py'\n", normalized(stderr()));

        assertEquals(1, execute(() -> {
            throw new IllegalArgumentException("Generated file escapes the project root: ../x.py");
        }));
        assertEquals("Error: Generated file escapes the project root: ../x.py\n", normalized(stderr()));
    }

    @Test
    void configureShowsDefaults() {
        assertEquals(0, run("configure"));

        assertEquals("output_dir=" + tmp.resolve("dist") + "\nconfig_file=<none>\n", normalized(stdout()));
    }

    @Test
    void configureDiscoversConfigInWorkingDirectory() throws Exception {
        Files.writeString(tmp.resolve("lf2x.yaml"), "paths:\n  output_dir: build/generated\n");

        assertEquals(0, run("configure"));

        assertEquals("output_dir=" + tmp.resolve("build/generated") + "\nconfig_file=" + tmp.resolve("lf2x.yaml") + "\n",
            normalized(stdout()));
    }

    @Test
    void configureHonoursExplicitOptions() throws Exception {
        Files.writeString(tmp.resolve("custom.yaml"), "paths:\n  output_dir: ignored\n");

        assertEquals(0, run("configure", "--output-dir", "out", "--config", "custom.yaml"));

        assertEquals("output_dir=" + tmp.resolve("out") + "\nconfig_file=" + tmp.resolve("custom.yaml") + "\n",
            normalized(stdout()));
    }

    @Test
    void convertWritesProjectAndReport() throws Exception {
        assertEquals(0, run("convert", "flow.json"));

        Path project = tmp.resolve("dist").resolve(SLUG);
        assertTrue(stdout().contains("Converted b94bc279-989c-42bb-95ec-6baea451549a (LINEAR) to langchain project at " + project));
        assertTrue(stdout().contains("  created README.md"));
        assertTrue(Files.exists(project.resolve("pyproject.toml")));
        assertTrue(Files.readString(project.resolve("conversion_report.md")).contains("- Files created: 17"));
        assertTrue(Files.exists(project.resolve("conversion_report.json")));
    }

    @Test
    void convertReportsConflictsWithExitOne() throws Exception {
        assertEquals(0, run("convert", "flow.json"));
        Path readme = tmp.resolve("dist").resolve(SLUG).resolve("README.md");
        Files.writeString(readme, "mine\n");

        assertEquals(1, run("convert", "flow.json"));
        assertTrue(stderr().contains("Refusing to overwrite existing file without --overwrite: " + readme));
        assertTrue(stderr().contains("Not written: 2"));
        assertEquals("mine\n", Files.readString(readme));

        assertEquals(0, run("convert", "flow.json", "--overwrite"));
        assertTrue(stdout().contains("  updated README.md"));
    }

    @Test
    void dryRunLeavesDiskUntouched() {
        assertEquals(0, run("convert", "flow.json", "--dry-run", "--output-dir", "preview"));

        assertTrue(stdout().contains("  would-create README.md"));
        assertFalse(Files.exists(tmp.resolve("preview")));
    }

    @Test
    void reportDirectoryCanBeChosen() {
        assertEquals(0, run("convert", "flow.json", "--report-dir", "reports"));

        assertTrue(Files.exists(tmp.resolve("reports/conversion_report.md")));
        assertFalse(Files.exists(tmp.resolve("dist").resolve(SLUG).resolve("conversion_report.md")));
    }

    @Test
    void badExportsExitWithOne() throws Exception {
        Files.writeString(tmp.resolve("old.json"), """
            { "id": "f", "name": "F", "version": "0.1.0", "nodes": [], "edges": [] }
            """);

        assertEquals(1, run("convert", "old.json"));
        assertTrue(stderr().contains("Unsupported flow version '0.1.0'"));
        assertEquals(1, run("convert", "missing.json"));
    }

    @Test
    void listsAndConvertsFlowsFromAServer() throws Exception {
        byte[] listing = """
            { "data": [ { "id": "b94bc279-989c-42bb-95ec-6baea451549a", "name": "Simple Passthrough", "tags": ["demo"] } ],
              "pagination": { "total": 1, "limit": 50, "offset": 0 } }
            """.getBytes(StandardCharsets.UTF_8);
        byte[] flow = Files.readAllBytes(tmp.resolve("flow.json"));
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/v1/flows", exchange -> {
            byte[] body = exchange.getRequestURI().getPath().endsWith("/flows") ? listing : flow;
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream stream = exchange.getResponseBody()) {
                stream.write(body);
            }
        });
        server.start();
        try {
            String url = "http://127.0.0.1:" + server.getAddress().getPort();

            assertEquals(0, run("list-flows", "--api-url", url));
            assertEquals("b94bc279-989c-42bb-95ec-6baea451549a\tSimple Passthrough\tdemo\n", normalized(stdout()));

            assertEquals(0, run("convert", "--flow-id", "b94bc279-989c-42bb-95ec-6baea451549a", "--api-url", url));
            assertTrue(Files.exists(tmp.resolve("dist").resolve(SLUG).resolve("README.md")));
        } finally {
            server.stop(0);
        }
    }

    private int run(String... args) {
        out.reset();
        err.reset();
        PrintStream stdout = new PrintStream(out, true, StandardCharsets.UTF_8);
        PrintStream stderr = new PrintStream(err, true, StandardCharsets.UTF_8);
        return new Lf2xMain(tmp, stdout, stderr).run(args);
    }

    private int execute(Lf2xMain.Command command) {
        out.reset();
        err.reset();
        PrintStream stdout = new PrintStream(out, true, StandardCharsets.UTF_8);
        PrintStream stderr = new PrintStream(err, true, StandardCharsets.UTF_8);
        return new Lf2xMain(tmp, stdout, stderr).execute("convert", command);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private static String normalized(String text) {
        return text.replace(System.lineSeparator(), "\n");
    }
}
