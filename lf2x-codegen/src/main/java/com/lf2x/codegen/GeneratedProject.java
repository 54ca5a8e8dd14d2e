package com.lf2x.codegen;

import com.lf2x.core.analysis.TargetRecommendation;
import com.lf2x.core.scaffold.WriteResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

public record GeneratedProject(
    Path root,
    String packageName,
    String flowId,
    TargetRecommendation target,
    List<WriteResult> writes
) {
    public GeneratedProject {
        root = Objects.requireNonNull(root, "root");
        packageName = Objects.requireNonNull(packageName, "packageName");
        flowId = Objects.requireNonNull(flowId, "flowId");
        target = Objects.requireNonNull(target, "target");
        writes = List.copyOf(Objects.requireNonNull(writes, "writes"));
    }
}
