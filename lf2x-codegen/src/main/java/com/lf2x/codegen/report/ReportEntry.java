package com.lf2x.codegen.report;

import com.lf2x.core.scaffold.WriteStatus;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/** One file row; {@code path} is relative to the project root when it lies below it. */
public record ReportEntry(Path path, WriteStatus status, List<String> todos) {
    public ReportEntry {
        path = Objects.requireNonNull(path, "path");
        status = Objects.requireNonNull(status, "status");
        todos = List.copyOf(Objects.requireNonNull(todos, "todos"));
    }
}
