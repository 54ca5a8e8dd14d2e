package com.lf2x.codegen;

import com.lf2x.config.ComponentRegistry;
import com.lf2x.config.FlowExportLoader;
import com.lf2x.config.Lf2xSettings;
import com.lf2x.core.FlowDocument;
import com.lf2x.core.IntermediateRepresentation;
import com.lf2x.core.IrBuilder;
import com.lf2x.core.Naming;
import com.lf2x.core.analysis.FlowAnalysis;
import com.lf2x.core.analysis.FlowAnalyzer;
import com.lf2x.core.analysis.TargetRecommendation;
import com.lf2x.core.scaffold.ProjectScaffoldWriter;
import com.lf2x.metrics.Metrics;
import com.lf2x.metrics.MetricsRecorder;
import com.lf2x.remote.http.FlowApiClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Export to project: load, build the IR, classify, then run the generator for the recommended
 * target into {@code <outputDir>/<slug of flow id>}.
 */
public final class FlowConverter {
    private static final Logger log = LoggerFactory.getLogger(FlowConverter.class);

    private final Lf2xSettings settings;
    private final Map<TargetRecommendation, ProjectGenerator> generators;

    public FlowConverter(Lf2xSettings settings, ComponentRegistry registry) {
        this(settings, List.of(new LangChainProjectGenerator(registry), new LangGraphProjectGenerator(registry)));
    }

    public FlowConverter(Lf2xSettings settings, List<ProjectGenerator> generators) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.generators = new EnumMap<>(TargetRecommendation.class);
        for (ProjectGenerator generator : generators) this.generators.put(generator.target(), generator);
        for (TargetRecommendation target : TargetRecommendation.values()) {
            if (!this.generators.containsKey(target)) {
                throw new IllegalArgumentException("No generator registered for target " + target.label());
            }
        }
    }

    /** Converter with the bundled component registry. */
    public static FlowConverter create(Lf2xSettings settings) throws IOException {
        return new FlowConverter(settings, ComponentRegistry.loadDefault());
    }

    public Lf2xSettings settings() {
        return settings;
    }

    public ConversionResult convert(Path source, boolean overwrite, boolean dryRun) throws IOException {
        Objects.requireNonNull(source, "source");
        FlowDocument document = FlowExportLoader.load(source, settings);
        return convertDocument(document, overwrite, dryRun);
    }

    /** Fetches the export from a flow server, then converts it like a local file. */
    public ConversionResult convertRemote(FlowApiClient client, String flowId, boolean overwrite, boolean dryRun)
            throws IOException {
        Objects.requireNonNull(client, "client");
        FlowDocument document = client.fetchFlowDocument(flowId, settings);
        return convertDocument(document, overwrite, dryRun);
    }

    public ConversionResult convertDocument(FlowDocument document, boolean overwrite, boolean dryRun)
            throws IOException {
        Objects.requireNonNull(document, "document");
        IntermediateRepresentation ir = IrBuilder.build(document);
        FlowAnalysis analysis = FlowAnalyzer.analyze(ir);
        MetricsRecorder rec = Metrics.recorder();
        rec.onFlowClassified(ir.flowId(), analysis.pattern());

        TargetRecommendation target = analysis.recommendedTarget();
        ProjectGenerator generator = generators.get(target);
        Path destination = destinationFor(ir, target);

        long start = System.nanoTime();
        boolean success = false;
        try {
            GeneratedProject project = generator.generate(ir, new ProjectScaffoldWriter(destination, overwrite, dryRun));
            success = true;
            log.info("converted flow '{}' ({}) to {} project at {}: {} file(s){}",
                ir.flowId(), analysis.pattern(), target.label(), project.root(), project.writes().size(),
                dryRun ? " [dry run]" : "");
            return new ConversionResult(
                ir.flowId(), analysis, target, project.root(), project.packageName(), project.writes());
        } finally {
            rec.onConversion(target.label(), System.nanoTime() - start, success);
        }
    }

    static Path destinationFor(IntermediateRepresentation ir, TargetRecommendation target) {
        String fallback = target == TargetRecommendation.LANGCHAIN
            ? LangChainProjectGenerator.DEFAULT_PACKAGE
            : LangGraphProjectGenerator.DEFAULT_PACKAGE;
        return ir.metadata().outputDir().resolve(Naming.slugify(ir.flowId(), fallback));
    }
}
