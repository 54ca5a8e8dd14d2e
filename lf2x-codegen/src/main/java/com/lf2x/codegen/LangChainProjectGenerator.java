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

/** Chain project for linear flows. The package is named after the flow id. */
public final class LangChainProjectGenerator extends AbstractProjectGenerator {
    static final String DEFAULT_PACKAGE = "lf2x_project";

    public LangChainProjectGenerator(ComponentRegistry registry) {
        super(registry);
    }

    @Override
    public TargetRecommendation target() {
        return TargetRecommendation.LANGCHAIN;
    }

    @Override
    public boolean supports(FlowPattern pattern) {
        return pattern == FlowPattern.LINEAR;
    }

    @Override
    public String packageName(IntermediateRepresentation ir) {
        return Naming.slugify(ir.flowId(), DEFAULT_PACKAGE);
    }

    @Override
    String templateDir() {
        return "langchain";
    }

    @Override
    List<GeneratedFile> layout(IntermediateRepresentation ir, Map<String, Object> context) throws IOException {
        context.put("targetTitle", "LangChain");
        context.put("runtimeDependency", "langchain>=0.1");
        context.put("configTestName", "test_settings_exposes_expected_attributes");

        Path pkg = Path.of("src", (String) context.get("packageName"));
        List<String> nodeTodos = new ArrayList<>();
        nodeTodos.add("Populate node factories for the generated flow");
        nodeTodos.addAll(componentNotes(ir));

        return List.of(
            file(Path.of("pyproject.toml"), "common/pyproject.toml", context, List.of()),
            file(pkg.resolve("__init__.py"), template("package_init.py"), context, List.of()),
            file(pkg.resolve("chains/__init__.py"), template("chains_init.py"), context, List.of()),
            file(pkg.resolve("chains/main_chain.py"), template("main_chain.py"), context, List.of()),
            file(pkg.resolve("nodes/__init__.py"), template("nodes_init.py"), context, nodeTodos),
            file(pkg.resolve("prompts/__init__.py"), template("prompts_init.py"), context,
                List.of("Replace prompt registry with project-specific prompts")),
            file(pkg.resolve("prompts/system_prompt.txt"), template("system_prompt.txt"), context,
                List.of("Author the system prompt for this flow")),
            file(pkg.resolve("tools/__init__.py"), template("tools_init.py"), context,
                List.of("Wire LangFlow tools into executable adapters")),
            file(pkg.resolve("tools/base_tool.py"), template("base_tool.py"), context, List.of()),
            file(pkg.resolve("config/__init__.py"), "common/config_init.py", context, List.of()),
            file(pkg.resolve("config/settings.py"), template("settings.py"), context,
                List.of("Map generated components to real configuration values")),
            file(pkg.resolve("cli.py"), template("cli.py"), context,
                List.of("Extend CLI commands to match production needs")),
            file(Path.of("tests/smoke/test_flow.py"), template("test_flow.py"), context, List.of()),
            file(Path.of("tests/unit/test_config.py"), "common/test_config.py", context, List.of()),
            file(Path.of("tests/unit/test_cli.py"), template("test_cli.py"), context, List.of()),
            file(Path.of("README.md"), template("README.md"), context, List.of()),
            file(Path.of(".env.example"), "common/env.example", context,
                List.of("Set real secret values for deployment"))
        );
    }
}
