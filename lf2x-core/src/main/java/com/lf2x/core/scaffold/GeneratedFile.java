package com.lf2x.core.scaffold;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A file a generator wants materialized under the project root.
 *
 * @param relativePath path below the project root; absolute paths are rejected
 * @param content      file body, opaque to the writer
 * @param todos        advisory notes the writer embeds as a leading comment block
 */
public record GeneratedFile(Path relativePath, String content, List<String> todos) {
    public GeneratedFile {
        relativePath = Objects.requireNonNull(relativePath, "relativePath");
        if (relativePath.isAbsolute()) {
            throw new IllegalArgumentException("Generated files must use relative paths: " + relativePath);
        }
        content = Objects.requireNonNull(content, "content");
        todos = List.copyOf(Objects.requireNonNull(todos, "todos"));
    }

    public GeneratedFile(Path relativePath, String content) {
        this(relativePath, content, List.of());
    }

    public static GeneratedFile of(String relativePath, String content, String... todos) {
        return new GeneratedFile(Path.of(relativePath), content, List.of(todos));
    }
}
