package com.lf2x.core.scaffold;

import com.lf2x.metrics.Metrics;
import com.lf2x.metrics.SimpleMetricsRecorder;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ProjectScaffoldWriterTest {

    @TempDir
    Path root;

    @BeforeEach
    void setup() {
        Metrics.setRecorder(new SimpleMetricsRecorder());
    }

    @Test
    void createsFilesAndParentDirectories() throws Exception {
        ProjectScaffoldWriter writer = new ProjectScaffoldWriter(root);

        List<WriteResult> results = writer.write(List.of(
            GeneratedFile.of("README.md", "# Demo\n"),
            GeneratedFile.of("src/app.py", "print('hi')\n")));

        assertEquals(2, results.size());
        assertEquals(WriteStatus.CREATED, results.get(0).status());
        assertEquals(WriteStatus.CREATED, results.get(1).status());
        assertEquals(root.resolve("README.md"), results.get(0).path());
        assertEquals("# Demo\n", read("README.md"));
        assertEquals("print('hi')\n", read("src/app.py"));
    }

    @Test
    void singleFileIsCreatedThenUnchanged() throws Exception {
        ProjectScaffoldWriter writer = new ProjectScaffoldWriter(root);
        List<GeneratedFile> files = List.of(GeneratedFile.of("a.txt", "x\n"));

        List<WriteResult> first = writer.write(files);
        assertEquals(List.of(new WriteResult(root.resolve("a.txt"), WriteStatus.CREATED, List.of())), first);
        assertEquals("x\n", read("a.txt"));

        List<WriteResult> second = writer.write(files);
        assertEquals(List.of(new WriteResult(root.resolve("a.txt"), WriteStatus.UNCHANGED, List.of())), second);
    }

    @Test
    void rewritingTheSameSetIsANoOp() throws Exception {
        List<GeneratedFile> files = List.of(
            GeneratedFile.of("pyproject.toml", "[project]\nname = 'demo'\n"),
            GeneratedFile.of("src/pkg/__init__.py", "", "fill in exports"),
            GeneratedFile.of("README.md", "# Demo", "describe the project"));

        List<WriteResult> first = new ProjectScaffoldWriter(root).write(files);
        long modified = Files.getLastModifiedTime(root.resolve("README.md")).toMillis();
        List<WriteResult> second = new ProjectScaffoldWriter(root).write(files);

        assertTrue(first.stream().allMatch(r -> r.status() == WriteStatus.CREATED));
        assertTrue(second.stream().allMatch(r -> r.status() == WriteStatus.UNCHANGED));
        assertEquals(modified, Files.getLastModifiedTime(root.resolve("README.md")).toMillis());
    }

    @Test
    void conflictingContentIsRejectedWithoutOverwrite() throws Exception {
        Files.writeString(root.resolve("README.md"), "original\n");
        ProjectScaffoldWriter writer = new ProjectScaffoldWriter(root);

        OverwriteConflictException exception = assertThrows(
            OverwriteConflictException.class,
            () -> writer.write(List.of(GeneratedFile.of("README.md", "changed\n"))));

        assertEquals(root.resolve("README.md"), exception.target());
        assertEquals("original\n", read("README.md"));
        MeterRegistry registry = Metrics.recorder().registry();
        assertEquals(1.0, registry.find("lf2x.scaffold.conflicts").counter().count());
    }

    @Test
    void conflictReportsCommittedAndUnreachedFiles() throws Exception {
        new ProjectScaffoldWriter(root).write(List.of(GeneratedFile.of("b.txt", "old\n")));
        Files.writeString(root.resolve("b.txt"), "edited by hand\n");

        ProjectScaffoldWriter writer = new ProjectScaffoldWriter(root);
        OverwriteConflictException exception = assertThrows(
            OverwriteConflictException.class,
            () -> writer.write(List.of(
                GeneratedFile.of("a.txt", "a\n"),
                GeneratedFile.of("b.txt", "old\n"),
                GeneratedFile.of("c.txt", "c\n"))));

        assertEquals(1, exception.committed().size());
        assertEquals(WriteStatus.CREATED, exception.committed().get(0).status());
        assertEquals(1, exception.changedOnDisk().size());
        assertEquals(List.of(Path.of("b.txt"), Path.of("c.txt")), exception.unreached());
        // no rollback
        assertTrue(Files.exists(root.resolve("a.txt")));
        assertFalse(Files.exists(root.resolve("c.txt")));
    }

    @Test
    void overwriteReplacesDivergedContent() throws Exception {
        Files.writeString(root.resolve("README.md"), "original\n");
        ProjectScaffoldWriter writer = new ProjectScaffoldWriter(root, true, false);

        List<WriteResult> results = writer.write(List.of(GeneratedFile.of("README.md", "changed\n")));

        assertEquals(List.of(new WriteResult(root.resolve("README.md"), WriteStatus.UPDATED, List.of())), results);
        assertEquals("changed\n", read("README.md"));
    }

    @Test
    void mutatedFileNeedsOverwriteOnRerun() throws Exception {
        List<GeneratedFile> files = List.of(
            GeneratedFile.of("src/main.py", "print('a')\n"),
            GeneratedFile.of("README.md", "# A\n"));
        new ProjectScaffoldWriter(root).write(files);
        Files.writeString(root.resolve("src/main.py"), "mutated\n");

        assertThrows(OverwriteConflictException.class, () -> new ProjectScaffoldWriter(root).write(files));

        List<WriteResult> results = new ProjectScaffoldWriter(root, true, false).write(files);
        assertEquals(WriteStatus.UPDATED, results.get(0).status());
        assertEquals(WriteStatus.UNCHANGED, results.get(1).status());
        assertEquals("print('a')\n", read("src/main.py"));
    }

    @Test
    void injectsTodoCommentsUsingTheExtensionLeader() throws Exception {
        ProjectScaffoldWriter writer = new ProjectScaffoldWriter(root);

        List<WriteResult> results = writer.write(List.of(
            GeneratedFile.of("src/module.py", "print('hi')\n", "review logic", "add tests"),
            GeneratedFile.of("README.md", "# Demo\n", "describe usage"),
            GeneratedFile.of(".env.example", "KEY=\n", "set secrets")));

        assertEquals(List.of("review logic", "add tests"), results.get(0).todos());
        assertEquals("# TODO(lf2x): review logic\n# TODO(lf2x): add tests\n\nprint('hi')\n", read("src/module.py"));
        assertEquals("> TODO(lf2x): describe usage\n\n# Demo\n", read("README.md"));
        assertEquals("# TODO(lf2x): set secrets\n\nKEY=\n", read(".env.example"));
    }

    @Test
    void unknownExtensionWithTodosIsRejected() throws Exception {
        ProjectScaffoldWriter writer = new ProjectScaffoldWriter(root);

        UnsupportedAnnotationTargetException exception = assertThrows(
            UnsupportedAnnotationTargetException.class,
            () -> writer.write(List.of(
                GeneratedFile.of("ok.txt", "fine"),
                GeneratedFile.of("binary.bin", "data", "cannot annotate"))));

        assertEquals(".bin", exception.extension());
        assertTrue(exception.getMessage().startsWith("Cannot inject TODO"));
        assertEquals(1, exception.committed().size());
        assertEquals(List.of(Path.of("binary.bin")), exception.unreached());
        assertFalse(Files.exists(root.resolve("binary.bin")));
    }

    @Test
    void fileWithoutExtensionAcceptsContentButNotTodos() throws Exception {
        ProjectScaffoldWriter writer = new ProjectScaffoldWriter(root);

        writer.write(List.of(GeneratedFile.of("Makefile", "all:\n")));
        UnsupportedAnnotationTargetException exception = assertThrows(
            UnsupportedAnnotationTargetException.class,
            () -> writer.write(List.of(GeneratedFile.of("Dockerfile", "FROM x", "pin image"))));

        assertTrue(exception.getMessage().endsWith("<none>"));
    }

    @Test
    void contentIsNormalizedToOneTrailingNewline() throws Exception {
        ProjectScaffoldWriter writer = new ProjectScaffoldWriter(root);

        writer.write(List.of(
            GeneratedFile.of("none.txt", "x"),
            GeneratedFile.of("many.txt", "x\n\n\n"),
            GeneratedFile.of("empty.txt", "")));

        assertEquals("x\n", read("none.txt"));
        assertEquals("x\n", read("many.txt"));
        assertEquals("\n", read("empty.txt"));
    }

    @Test
    void dryRunReportsStatusesWithoutTouchingDisk() throws Exception {
        Files.writeString(root.resolve("existing.md"), "old\n");
        ProjectScaffoldWriter writer = new ProjectScaffoldWriter(root, true, true);

        List<WriteResult> results = writer.write(List.of(
            GeneratedFile.of("README.md", "# Demo\n"),
            GeneratedFile.of("nested/dir/app.py", "pass\n"),
            GeneratedFile.of("existing.md", "new\n")));

        assertEquals(WriteStatus.WOULD_CREATE, results.get(0).status());
        assertEquals(WriteStatus.WOULD_CREATE, results.get(1).status());
        assertEquals(WriteStatus.WOULD_UPDATE, results.get(2).status());
        assertFalse(Files.exists(root.resolve("README.md")));
        assertFalse(Files.exists(root.resolve("nested")));
        assertEquals("old\n", read("existing.md"));
    }

    @Test
    void dryRunWithoutOverwriteStillRaisesConflicts() throws Exception {
        Files.writeString(root.resolve("existing.md"), "old\n");
        ProjectScaffoldWriter writer = new ProjectScaffoldWriter(root, false, true);

        assertThrows(OverwriteConflictException.class,
            () -> writer.write(List.of(GeneratedFile.of("existing.md", "new\n"))));
    }

    @Test
    void leavesUnrelatedFilesAlone() throws Exception {
        Files.writeString(root.resolve("notes.txt"), "keep me\n");

        new ProjectScaffoldWriter(root, true, false).write(List.of(GeneratedFile.of("a.txt", "a")));

        assertEquals("keep me\n", read("notes.txt"));
    }

    @Test
    void rejectsAbsoluteAndEscapingPaths() {
        assertThrows(IllegalArgumentException.class,
            () -> new GeneratedFile(root.resolve("abs.txt"), "x"));

        ProjectScaffoldWriter writer = new ProjectScaffoldWriter(root);
        assertThrows(IllegalArgumentException.class,
            () -> writer.write(List.of(GeneratedFile.of("../outside.txt", "x"))));
    }

    @Test
    void recordsStatusCounters() throws Exception {
        ProjectScaffoldWriter writer = new ProjectScaffoldWriter(root);
        List<GeneratedFile> files = List.of(GeneratedFile.of("a.txt", "a"), GeneratedFile.of("b.txt", "b"));

        writer.write(files);
        writer.write(files);

        MeterRegistry registry = Metrics.recorder().registry();
        assertEquals(2.0, registry.find("lf2x.scaffold.created").counter().count());
        assertEquals(2.0, registry.find("lf2x.scaffold.unchanged").counter().count());
    }

    private String read(String relative) throws Exception {
        return Files.readString(root.resolve(relative), StandardCharsets.UTF_8);
    }
}
