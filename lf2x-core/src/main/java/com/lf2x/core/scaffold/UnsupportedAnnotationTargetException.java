package com.lf2x.core.scaffold;

import java.nio.file.Path;
import java.util.List;

/** A file carries todo annotations but its extension has no known comment syntax. */
public final class UnsupportedAnnotationTargetException extends ScaffoldWriteException {
    private final String extension;

    public UnsupportedAnnotationTargetException(
        Path target,
        String extension,
        List<WriteResult> committed,
        List<Path> unreached
    ) {
        super("Cannot inject TODO markers for unsupported file type: "
            + (extension.isEmpty() ? "<none>" : extension), target, committed, unreached);
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
