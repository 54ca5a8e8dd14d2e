package com.lf2x.codegen.report;

import java.nio.file.Path;

/** Locations of the persisted report files. */
public record ReportArtifacts(Path markdown, Path json) {}
