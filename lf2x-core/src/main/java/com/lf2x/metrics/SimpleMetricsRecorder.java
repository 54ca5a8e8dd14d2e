package com.lf2x.metrics;

import com.lf2x.core.analysis.FlowPattern;
import com.lf2x.core.scaffold.WriteStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

public final class SimpleMetricsRecorder implements MetricsRecorder {
    private final MeterRegistry registry;

    public SimpleMetricsRecorder() {
        this.registry = new SimpleMeterRegistry();
    }

    public SimpleMetricsRecorder(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onFlowClassified(String flowId, FlowPattern pattern) {
        Counter.builder("lf2x.flow.pattern." + pattern.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    @Override
    public void onFileWritten(WriteStatus status) {
        Counter.builder("lf2x.scaffold." + status.label()).register(registry).increment();
    }

    @Override
    public void onWriteConflict(String relativePath) {
        Counter.builder("lf2x.scaffold.conflicts").register(registry).increment();
    }

    @Override
    public void onConversion(String target, long nanos, boolean success) {
        Timer.builder("lf2x.conversion." + target + ".duration")
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
        if (!success) {
            Counter.builder("lf2x.conversion." + target + ".failures").register(registry).increment();
        }
    }

    @Override
    public void onRemoteRequest(int statusCode) {
        Counter.builder("lf2x.remote.requests").register(registry).increment();
        if (statusCode >= 400) {
            Counter.builder("lf2x.remote.errors").register(registry).increment();
        }
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }
}
