package com.lf2x.codegen;

import com.lf2x.config.ComponentRegistry;
import com.lf2x.core.IntermediateRepresentation;
import com.lf2x.core.Naming;
import com.lf2x.core.analysis.FlowPattern;
import com.lf2x.core.analysis.TargetRecommendation;
import com.lf2x.core.scaffold.GeneratedFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** State graph project for branching and cyclic flows. The package is named after the flow name. */
public final class LangGraphProjectGenerator extends AbstractProjectGenerator {
    static final String DEFAULT_PACKAGE = "lf2x_graph";

    public LangGraphProjectGenerator(ComponentRegistry registry) {
        super(registry);
    }

    @Override
    public TargetRecommendation target() {
        return TargetRecommendation.LANGGRAPH;
    }

    @Override
    public boolean supports(FlowPattern pattern) {
        return pattern == FlowPattern.BRANCHING || pattern == FlowPattern.CYCLIC;
    }

    @Override
    public String packageName(IntermediateRepresentation ir) {
        String source = ir.name().isBlank() ? ir.flowId() : ir.name();
        return Naming.slugify(source, DEFAULT_PACKAGE);
    }

    @Override
    String templateDir() {
        return "langgraph";
    }

    @Override
    List<GeneratedFile> layout(IntermediateRepresentation ir, Map<String, Object> context) throws IOException {
        context.put("targetTitle", "LangGraph");
        context.put("runtimeDependency", "langgraph>=0.0.30");
        context.put("configTestName", "test_settings_flags_are_accessible");

        Path pkg = Path.of("src", (String) context.get("packageName"));
        List<String> nodeTodos = new ArrayList<>();
        nodeTodos.add("Implement node-level handlers for LangGraph");
        nodeTodos.addAll(componentNotes(ir));

        return List.of(
            file(Path.of("pyproject.toml"), "common/pyproject.toml", context, List.of()),
            file(pkg.resolve("__init__.py"), template("package_init.py"), context, List.of()),
            file(pkg.resolve("graphs/__init__.py"), template("graphs_init.py"), context, List.of()),
            file(pkg.resolve("graphs/main_graph.py"), template("main_graph.py"), context, List.of()),
            file(pkg.resolve("nodes/__init__.py"), template("nodes_init.py"), context, nodeTodos),
            file(pkg.resolve("state.py"), template("state.py"), context,
                List.of("Define structured state for graph execution")),
            file(pkg.resolve("prompts/__init__.py"), template("prompts_init.py"), context,
                List.of("Customize prompt formatting for the generated flow")),
            file(pkg.resolve("tools/__init__.py"), template("tools_init.py"), context,
                List.of("Hook external tools into the graph")),
            file(pkg.resolve("tools/base_tool.py"), template("base_tool.py"), context, List.of()),
            file(pkg.resolve("config/__init__.py"), "common/config_init.py", context, List.of()),
            file(pkg.resolve("config/settings.py"), template("settings.py"), context,
                List.of("Connect graph configuration to deployment runtime")),
            file(pkg.resolve("cli.py"), template("cli.py"), context,
                List.of("Expose graph operations via CLI")),
            file(Path.of("tests/smoke/test_flow.py"), template("test_flow.py"), context, List.of()),
            file(Path.of("tests/unit/test_config.py"), "common/test_config.py", context, List.of()),
            file(Path.of("tests/unit/test_cli.py"), template("test_cli.py"), context, List.of()),
            file(Path.of("README.md"), template("README.md"), context, List.of()),
            file(Path.of(".env.example"), "common/env.example", context,
                List.of("Set graph secrets before deployment"))
        );
    }
}
