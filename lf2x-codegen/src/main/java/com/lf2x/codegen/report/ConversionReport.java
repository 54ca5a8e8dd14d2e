package com.lf2x.codegen.report;

import com.lf2x.core.analysis.TargetRecommendation;
import com.lf2x.core.scaffold.WriteStatus;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record ConversionReport(
    String flowId,
    TargetRecommendation target,
    Path projectRoot,
    List<ReportEntry> entries
) {
    public ConversionReport {
        flowId = Objects.requireNonNull(flowId, "flowId");
        target = Objects.requireNonNull(target, "target");
        projectRoot = Objects.requireNonNull(projectRoot, "projectRoot");
        entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
    }

    /** Entry count per status; statuses that never occur are absent. */
    public Map<WriteStatus, Integer> counts() {
        Map<WriteStatus, Integer> counts = new EnumMap<>(WriteStatus.class);
        for (ReportEntry entry : entries) counts.merge(entry.status(), 1, Integer::sum);
        return counts;
    }

    public int count(WriteStatus status) {
        return counts().getOrDefault(status, 0);
    }
}
