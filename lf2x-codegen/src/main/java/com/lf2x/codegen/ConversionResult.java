package com.lf2x.codegen;

import com.lf2x.core.analysis.FlowAnalysis;
import com.lf2x.core.analysis.TargetRecommendation;
import com.lf2x.core.scaffold.WriteResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/** Outcome of converting one flow. */
public record ConversionResult(
    String flowId,
    FlowAnalysis analysis,
    TargetRecommendation target,
    Path projectRoot,
    String packageName,
    List<WriteResult> writes
) {
    public ConversionResult {
        flowId = Objects.requireNonNull(flowId, "flowId");
        analysis = Objects.requireNonNull(analysis, "analysis");
        target = Objects.requireNonNull(target, "target");
        projectRoot = Objects.requireNonNull(projectRoot, "projectRoot");
        packageName = Objects.requireNonNull(packageName, "packageName");
        writes = List.copyOf(Objects.requireNonNull(writes, "writes"));
    }
}
