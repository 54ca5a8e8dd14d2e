package com.lf2x.metrics;

import com.lf2x.core.analysis.FlowPattern;
import com.lf2x.core.scaffold.WriteStatus;
import io.micrometer.core.instrument.MeterRegistry;

public interface MetricsRecorder {
    void onFlowClassified(String flowId, FlowPattern pattern);
    void onFileWritten(WriteStatus status);
    void onWriteConflict(String relativePath);
    void onConversion(String target, long nanos, boolean success);
    void onRemoteRequest(int statusCode);
    MeterRegistry registry();
}
