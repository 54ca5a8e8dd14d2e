package com.lf2x.core.scaffold;

/** Outcome of persisting one generated file. */
public enum WriteStatus {
    CREATED("created"),
    UPDATED("updated"),
    UNCHANGED("unchanged"),
    WOULD_CREATE("would-create"),
    WOULD_UPDATE("would-update");

    private final String label;

    WriteStatus(String label) {
        this.label = label;
    }

    /** The lower-case, hyphenated name used in reports. */
    public String label() {
        return label;
    }

    public boolean changesDisk() {
        return this == CREATED || this == UPDATED;
    }
}
