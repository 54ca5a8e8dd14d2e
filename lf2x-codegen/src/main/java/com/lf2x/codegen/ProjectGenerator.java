package com.lf2x.codegen;

import com.lf2x.core.IntermediateRepresentation;
import com.lf2x.core.analysis.FlowPattern;
import com.lf2x.core.analysis.TargetRecommendation;
import com.lf2x.core.scaffold.GeneratedFile;
import com.lf2x.core.scaffold.ProjectScaffoldWriter;
import com.lf2x.core.scaffold.ScaffoldWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Turns an IR into the files of a runnable project skeleton for one target framework. */
public interface ProjectGenerator {

    TargetRecommendation target();

    boolean supports(FlowPattern pattern);

    /** Python package name of the generated project. */
    String packageName(IntermediateRepresentation ir);

    /**
     * Files in write order, with their todo annotations.
     *
     * @throws IllegalArgumentException when the flow shape is not handled by this generator
     */
    List<GeneratedFile> files(IntermediateRepresentation ir) throws IOException;

    /** Renders the files and hands them to {@code writer}. */
    GeneratedProject generate(IntermediateRepresentation ir, ScaffoldWriter writer) throws IOException;

    /** Generates into {@code destination}, refusing to overwrite diverged files. */
    default GeneratedProject generate(IntermediateRepresentation ir, Path destination) throws IOException {
        return generate(ir, new ProjectScaffoldWriter(destination));
    }
}
