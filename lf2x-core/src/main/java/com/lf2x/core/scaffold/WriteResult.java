package com.lf2x.core.scaffold;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

public record WriteResult(Path path, WriteStatus status, List<String> todos) {
    public WriteResult {
        path = Objects.requireNonNull(path, "path");
        status = Objects.requireNonNull(status, "status");
        todos = List.copyOf(Objects.requireNonNull(todos, "todos"));
    }
}
