package com.lf2x.core.scaffold;

import com.lf2x.metrics.Metrics;
import com.lf2x.metrics.MetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes generated files with idempotent semantics.
 *
 * <p>Per file: absent targets are created, byte-identical targets are left alone, differing targets
 * are replaced only when overwriting is allowed and otherwise stop the batch with an
 * {@link OverwriteConflictException}. Dry runs compute the same statuses without touching disk.
 */
public final class ProjectScaffoldWriter implements ScaffoldWriter {
    private static final Logger log = LoggerFactory.getLogger(ProjectScaffoldWriter.class);
    private static final String TODO_MARKER = "TODO(lf2x)";

    private final Path root;
    private final boolean overwrite;
    private final boolean dryRun;
    private final Charset charset;

    public ProjectScaffoldWriter(Path root) {
        this(root, false, false);
    }

    public ProjectScaffoldWriter(Path root, boolean overwrite, boolean dryRun) {
        this(root, overwrite, dryRun, StandardCharsets.UTF_8);
    }

    public ProjectScaffoldWriter(Path root, boolean overwrite, boolean dryRun, Charset charset) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.overwrite = overwrite;
        this.dryRun = dryRun;
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    @Override
    public Path root() {
        return root;
    }

    public boolean overwrite() { return overwrite; }
    public boolean dryRun() { return dryRun; }

    @Override
    public List<WriteResult> write(List<GeneratedFile> files) throws IOException {
        Objects.requireNonNull(files, "files");
        MetricsRecorder rec = Metrics.recorder();

        List<WriteResult> results = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            GeneratedFile file = files.get(i);
            Path target = resolve(file.relativePath());

            Optional<String> rendered = render(file);
            if (rendered.isEmpty()) {
                throw new UnsupportedAnnotationTargetException(
                    target, CommentSyntax.extension(target), results, remaining(files, i));
            }
            byte[] content = rendered.get().getBytes(charset);

            WriteStatus status;
            if (Files.exists(target)) {
                if (Arrays.equals(Files.readAllBytes(target), content)) {
                    status = WriteStatus.UNCHANGED;
                } else if (!overwrite) {
                    rec.onWriteConflict(file.relativePath().toString());
                    log.warn("conflict at {} after {} file(s) processed", target, results.size());
                    throw new OverwriteConflictException(target, results, remaining(files, i));
                } else {
                    status = dryRun ? WriteStatus.WOULD_UPDATE : WriteStatus.UPDATED;
                }
            } else {
                status = dryRun ? WriteStatus.WOULD_CREATE : WriteStatus.CREATED;
            }

            if (status.changesDisk()) {
                Path parent = target.getParent();
                if (parent != null) Files.createDirectories(parent);
                Files.write(target, content);
            }

            log.debug("{} {}", status.label(), target);
            rec.onFileWritten(status);
            results.add(new WriteResult(target, status, file.todos()));
        }
        return results;
    }

    /** Rendered file content, or empty when the file carries todos its extension cannot hold. */
    Optional<String> render(GeneratedFile file) {
        String body = withSingleTrailingNewline(file.content());
        if (file.todos().isEmpty()) return Optional.of(body);

        Optional<String> leader = CommentSyntax.leaderFor(file.relativePath());
        if (leader.isEmpty()) return Optional.empty();

        StringBuilder out = new StringBuilder();
        for (String todo : file.todos()) {
            out.append(leader.get()).append(' ').append(TODO_MARKER).append(": ").append(todo).append('\n');
        }
        return Optional.of(out.append('\n').append(body).toString());
    }

    private Path resolve(Path relativePath) {
        Path target = root.resolve(relativePath).normalize();
        if (!target.startsWith(root)) {
            throw new IllegalArgumentException("Generated file escapes the project root: " + relativePath);
        }
        return target;
    }

    private static String withSingleTrailingNewline(String content) {
        int end = content.length();
        while (end > 0 && content.charAt(end - 1) == '\n') end--;
        return content.substring(0, end) + "\n";
    }

    private static List<Path> remaining(List<GeneratedFile> files, int from) {
        List<Path> paths = new ArrayList<>(files.size() - from);
        for (int i = from; i < files.size(); i++) paths.add(files.get(i).relativePath());
        return paths;
    }
}
