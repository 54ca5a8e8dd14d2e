package com.lf2x.core;

import java.nio.file.Path;
import java.util.Objects;

public record FlowMetadata(Path sourcePath, Path outputDir) {
    public FlowMetadata {
        sourcePath = Objects.requireNonNull(sourcePath, "sourcePath");
        outputDir = Objects.requireNonNull(outputDir, "outputDir");
    }
}
