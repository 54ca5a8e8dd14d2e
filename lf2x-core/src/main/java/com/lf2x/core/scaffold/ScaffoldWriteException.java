package com.lf2x.core.scaffold;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A writer error that halted a batch. Reports which files had already been processed and which
 * were never reached (the failing file first).
 */
public abstract class ScaffoldWriteException extends IOException {
    private final Path target;
    private final List<WriteResult> committed;
    private final List<Path> unreached;

    protected ScaffoldWriteException(String message, Path target, List<WriteResult> committed, List<Path> unreached) {
        super(message);
        this.target = Objects.requireNonNull(target, "target");
        this.committed = List.copyOf(Objects.requireNonNull(committed, "committed"));
        this.unreached = List.copyOf(Objects.requireNonNull(unreached, "unreached"));
    }

    /** Absolute path of the file that stopped the batch. */
    public Path target() {
        return target;
    }

    /** Results for the files processed before the failure, in input order. */
    public List<WriteResult> committed() {
        return committed;
    }

    /** Results from {@link #committed()} that actually changed the disk. */
    public List<WriteResult> changedOnDisk() {
        return committed.stream().filter(result -> result.status().changesDisk()).toList();
    }

    /** Relative paths of the failing file and every file after it. */
    public List<Path> unreached() {
        return unreached;
    }
}
