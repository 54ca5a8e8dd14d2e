package com.lf2x.core;

import java.nio.file.Path;
import java.util.Objects;

/** Where the flow came from and where generated projects go. */
public record IrMetadata(Path sourcePath, Path outputDir) {
    public IrMetadata {
        sourcePath = Objects.requireNonNull(sourcePath, "sourcePath");
        outputDir = Objects.requireNonNull(outputDir, "outputDir");
    }
}
