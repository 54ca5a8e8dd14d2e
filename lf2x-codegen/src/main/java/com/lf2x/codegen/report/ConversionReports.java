package com.lf2x.codegen.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lf2x.codegen.ConversionResult;
import com.lf2x.core.analysis.TargetRecommendation;
import com.lf2x.core.scaffold.ScaffoldWriteException;
import com.lf2x.core.scaffold.WriteResult;
import com.lf2x.core.scaffold.WriteStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Builds and persists conversion reports ({@code conversion_report.md} and {@code .json}). */
public final class ConversionReports {
    private static final Logger log = LoggerFactory.getLogger(ConversionReports.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static final String MARKDOWN_FILE = "conversion_report.md";
    public static final String JSON_FILE = "conversion_report.json";

    private ConversionReports() {}

    public static ConversionReport build(ConversionResult result) {
        Objects.requireNonNull(result, "result");
        return build(result.flowId(), result.target(), result.projectRoot(), result.writes());
    }

    public static ConversionReport build(
        String flowId,
        TargetRecommendation target,
        Path projectRoot,
        List<WriteResult> writes
    ) {
        Path root = projectRoot.toAbsolutePath().normalize();
        List<ReportEntry> entries = new ArrayList<>(writes.size());
        for (WriteResult write : writes) {
            Path path = write.path().toAbsolutePath().normalize();
            Path shown = path.startsWith(root) ? root.relativize(path) : write.path();
            entries.add(new ReportEntry(shown, write.status(), write.todos()));
        }
        return new ConversionReport(flowId, target, root, entries);
    }

    /** Writes both report files into {@code destination}, or the project root when it is null. */
    public static ReportArtifacts write(ConversionReport report, Path destination) throws IOException {
        Objects.requireNonNull(report, "report");
        Path dir = (destination != null ? destination : report.projectRoot()).toAbsolutePath().normalize();
        Files.createDirectories(dir);

        Path markdown = dir.resolve(MARKDOWN_FILE);
        Path json = dir.resolve(JSON_FILE);
        Files.writeString(markdown, renderMarkdown(report), StandardCharsets.UTF_8);
        Files.writeString(json, renderJson(report), StandardCharsets.UTF_8);
        log.debug("wrote conversion report for '{}' to {}", report.flowId(), dir);
        return new ReportArtifacts(markdown, json);
    }

    public static String renderMarkdown(ConversionReport report) {
        List<String> lines = new ArrayList<>();
        lines.add("# Conversion Report for `" + report.flowId() + "`");
        lines.add("");
        lines.add("- Target: " + report.target().label());
        lines.add("- Project root: `" + report.projectRoot() + "`");
        lines.add("- Files created: " + report.count(WriteStatus.CREATED));
        lines.add("- Files updated: " + report.count(WriteStatus.UPDATED));
        lines.add("- Files unchanged: " + report.count(WriteStatus.UNCHANGED));
        int wouldCreate = report.count(WriteStatus.WOULD_CREATE);
        int wouldUpdate = report.count(WriteStatus.WOULD_UPDATE);
        if (wouldCreate > 0 || wouldUpdate > 0) {
            lines.add("- Files that would be created: " + wouldCreate);
            lines.add("- Files that would be updated: " + wouldUpdate);
        }
        lines.add("");
        lines.add("## Files");
        lines.add("| Path | Status | TODOs |");
        lines.add("| --- | --- | --- |");
        for (ReportEntry entry : report.entries()) {
            lines.add("| " + entry.path() + " | " + entry.status().label() + " | "
                + String.join("<br />", entry.todos()) + " |");
        }
        return String.join("\n", lines) + "\n";
    }

    public static String renderJson(ConversionReport report) throws IOException {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("flow_id", report.flowId());
        root.put("target", report.target().label());
        root.put("project_root", report.projectRoot().toString());

        ObjectNode counts = root.putObject("counts");
        for (Map.Entry<WriteStatus, Integer> count : report.counts().entrySet()) {
            counts.put(count.getKey().label(), count.getValue());
        }

        ArrayNode files = root.putArray("files");
        for (ReportEntry entry : report.entries()) {
            ObjectNode file = files.addObject();
            file.put("path", entry.path().toString());
            file.put("status", entry.status().label());
            ArrayNode todos = file.putArray("todos");
            entry.todos().forEach(todos::add);
        }
        return MAPPER.writeValueAsString(root) + "\n";
    }

    /** Human-readable account of a halted batch: the error, what was written, what was not. */
    public static String describeFailure(ScaffoldWriteException failure) {
        Objects.requireNonNull(failure, "failure");
        StringBuilder out = new StringBuilder(failure.getMessage()).append('\n');
        out.append("Processed before the failure: ").append(failure.committed().size()).append('\n');
        for (WriteResult result : failure.committed()) {
            out.append("  ").append(result.status().label()).append(' ').append(result.path()).append('\n');
        }
        out.append("Not written: ").append(failure.unreached().size()).append('\n');
        for (Path path : failure.unreached()) {
            out.append("  ").append(path).append('\n');
        }
        return out.toString();
    }
}
