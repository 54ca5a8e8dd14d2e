package com.lf2x.core.scaffold;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/** Line comment leaders by file extension, used to embed todo annotations. */
final class CommentSyntax {
    private static final Map<String, String> LEADERS = Map.of(
        ".py", "#",
        ".toml", "#",
        ".md", ">",
        ".txt", "#",
        ".yaml", "#",
        ".yml", "#",
        ".ini", "#",
        ".cfg", "#",
        ".env", "#",
        ".example", "#"
    );

    private CommentSyntax() {}

    static Optional<String> leaderFor(Path path) {
        return Optional.ofNullable(LEADERS.get(extension(path)));
    }

    /** The suffix from the last dot of the file name, or an empty string ({@code .env.example} yields {@code .example}). */
    static String extension(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) return "";
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot);
    }
}
