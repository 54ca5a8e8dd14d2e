package com.lf2x.core.scaffold;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Persists generated files below a project root.
 *
 * <p>Files are processed strictly in the given order and results come back in the same order. A
 * {@link ScaffoldWriteException} halts the batch without rolling back files already written.
 */
public interface ScaffoldWriter {
    Path root();

    List<WriteResult> write(List<GeneratedFile> files) throws IOException;
}
