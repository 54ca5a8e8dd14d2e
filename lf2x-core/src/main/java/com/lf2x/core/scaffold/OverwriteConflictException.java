package com.lf2x.core.scaffold;

import java.nio.file.Path;
import java.util.List;

/** An existing file differs from the generated content and overwriting was not allowed. */
public final class OverwriteConflictException extends ScaffoldWriteException {
    public OverwriteConflictException(Path target, List<WriteResult> committed, List<Path> unreached) {
        super("Refusing to overwrite existing file without --overwrite: " + target, target, committed, unreached);
    }
}
