package com.lf2x.metrics;

import java.util.Objects;

/**
 * Process-wide {@link MetricsRecorder} shared by the IR analyzer, the scaffold writer, the
 * converter and the flow API client. Tests swap in a fresh {@link SimpleMetricsRecorder} per case.
 */
public final class Metrics {
    private static volatile MetricsRecorder recorder = new SimpleMetricsRecorder();

    private Metrics() {}

    public static MetricsRecorder recorder() {
        return recorder;
    }

    /** Replaces the recorder; counters already registered on the previous one are not carried over. */
    public static void setRecorder(MetricsRecorder replacement) {
        recorder = Objects.requireNonNull(replacement, "recorder");
    }
}
