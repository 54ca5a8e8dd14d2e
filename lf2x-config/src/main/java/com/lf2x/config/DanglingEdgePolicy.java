package com.lf2x.config;

import java.io.IOException;
import java.util.Locale;

/** What the loader does with edges whose endpoints are not declared as nodes. */
public enum DanglingEdgePolicy {
    /** Keep them; the analyzer treats unknown endpoints as extra graph vertices. */
    TOLERATE,
    /** Fail the load with a {@link DanglingEdgeException}. */
    REJECT;

    static DanglingEdgePolicy parse(String raw) throws IOException {
        return switch (raw.strip().toLowerCase(Locale.ROOT)) {
            case "tolerate", "allow", "ignore" -> TOLERATE;
            case "reject", "error", "strict" -> REJECT;
            default -> throw new IOException("Unsupported dangling edge policy: " + raw);
        };
    }
}
