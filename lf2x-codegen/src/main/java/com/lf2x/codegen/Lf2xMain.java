package com.lf2x.codegen;

import com.lf2x.codegen.report.ConversionReport;
import com.lf2x.codegen.report.ConversionReports;
import com.lf2x.codegen.report.ReportArtifacts;
import com.lf2x.config.Lf2xSettings;
import com.lf2x.core.scaffold.ScaffoldWriteException;
import com.lf2x.core.scaffold.WriteResult;
import com.lf2x.remote.http.FlowApiClient;
import com.lf2x.remote.http.FlowSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Command line entry point.
 *
 * <pre>
 * lf2x version
 * lf2x configure [--output-dir DIR] [--config FILE]
 * lf2x convert (EXPORT.json | --flow-id ID) [--output-dir DIR] [--config FILE] [--api-url URL]
 *              [--token TOKEN] [--overwrite] [--dry-run] [--report-dir DIR]
 * lf2x list-flows [--config FILE] [--api-url URL] [--token TOKEN] [--tags a,b] [--page-size N]
 * </pre>
 *
 * Exit codes: 0 success, 1 conversion or server error, 2 usage error.
 */
public final class Lf2xMain {
    private static final Logger log = LoggerFactory.getLogger(Lf2xMain.class);

    public static final String VERSION = "0.1.0";

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private static final String USAGE_TEXT = String.join("\n",
        "Usage: lf2x <command> [options]",
        "  version",
        "  configure [--output-dir DIR] [--config FILE]",
        "  convert (EXPORT.json | --flow-id ID) [--output-dir DIR] [--config FILE] [--api-url URL]",
        "          [--token TOKEN] [--overwrite] [--dry-run] [--report-dir DIR]",
        "  list-flows [--config FILE] [--api-url URL] [--token TOKEN] [--tags a,b] [--page-size N]");

    private final Path workingDir;
    private final PrintStream out;
    private final PrintStream err;

    Lf2xMain(Path workingDir, PrintStream out, PrintStream err) {
        this.workingDir = workingDir.toAbsolutePath().normalize();
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new Lf2xMain(Path.of(""), System.out, System.err).run(args);
        if (code != OK) System.exit(code);
    }

    int run(String[] args) {
        if (args.length == 0) {
            err.println(USAGE_TEXT);
            return USAGE;
        }
        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        return execute(args[0], () -> switch (args[0]) {
            case "version" -> version();
            case "configure" -> configure(Options.parse(rest, Set.of("--output-dir", "--config"), Set.of()));
            case "convert" -> convert(Options.parse(rest,
                Set.of("--output-dir", "--config", "--report-dir", "--flow-id", "--api-url", "--token"),
                Set.of("--overwrite", "--dry-run")));
            case "list-flows" -> listFlows(Options.parse(rest,
                Set.of("--config", "--api-url", "--token", "--tags", "--page-size"), Set.of()));
            case "help", "-h", "--help" -> help();
            default -> throw new UsageException("Unknown command: " + args[0] + "\n" + USAGE_TEXT);
        });
    }

    /** Maps a command's failure to an exit code and an {@code Error:} line on stderr. */
    int execute(String name, Command command) {
        try {
            return command.call();
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            return USAGE;
        } catch (ScaffoldWriteException e) {
            log.warn("conversion halted at {}", e.target());
            err.print("Error: " + ConversionReports.describeFailure(e));
            return FAILED;
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            log.debug("command '{}' failed", name, e);
            err.println("Error: " + e.getMessage());
            return FAILED;
        }
    }

    private int version() {
        out.println(VERSION);
        return OK;
    }

    private int help() {
        out.println(USAGE_TEXT);
        return OK;
    }

    private int configure(Options options) throws IOException {
        Lf2xSettings settings = settings(options);
        out.println("output_dir=" + settings.resolveOutputDir(workingDir));
        out.println("config_file=" + (settings.configFile() != null ? settings.configFile() : "<none>"));
        return OK;
    }

    private int convert(Options options) throws IOException, UsageException {
        String flowId = options.value("--flow-id");
        if (flowId == null && options.positionals().size() != 1) {
            throw new UsageException("convert expects exactly one export file or --flow-id");
        }
        if (flowId != null && !options.positionals().isEmpty()) {
            throw new UsageException("convert takes either an export file or --flow-id, not both");
        }

        Lf2xSettings settings = settings(options);
        Lf2xSettings resolved = settings.withOverrides(settings.resolveOutputDir(workingDir), null, null, null);
        FlowConverter converter = FlowConverter.create(resolved);
        boolean overwrite = options.flag("--overwrite");
        boolean dryRun = options.flag("--dry-run");

        ConversionResult result = flowId != null
            ? converter.convertRemote(client(resolved), flowId, overwrite, dryRun)
            : converter.convert(workingDir.resolve(options.positionals().get(0)), overwrite, dryRun);

        out.println("Converted " + result.flowId() + " (" + result.analysis().pattern() + ") to "
            + result.target().label() + " project at " + result.projectRoot());
        for (WriteResult write : result.writes()) {
            out.println("  " + write.status().label() + " " + result.projectRoot().relativize(write.path()));
        }

        String reportDir = options.value("--report-dir");
        if (!dryRun || reportDir != null) {
            ConversionReport report = ConversionReports.build(result);
            ReportArtifacts artifacts = ConversionReports.write(
                report, reportDir != null ? workingDir.resolve(reportDir) : null);
            out.println("Report: " + artifacts.markdown());
        }
        return OK;
    }

    private int listFlows(Options options) throws IOException, UsageException {
        Lf2xSettings settings = settings(options);
        List<String> tags = new ArrayList<>();
        String rawTags = options.value("--tags");
        if (rawTags != null) {
            for (String tag : rawTags.split(",")) {
                if (!tag.isBlank()) tags.add(tag.strip());
            }
        }
        int pageSize = FlowApiClient.DEFAULT_PAGE_SIZE;
        String rawPageSize = options.value("--page-size");
        if (rawPageSize != null) {
            try {
                pageSize = Integer.parseInt(rawPageSize);
            } catch (NumberFormatException e) {
                throw new UsageException("--page-size must be an integer: " + rawPageSize);
            }
            if (pageSize <= 0) throw new UsageException("--page-size must be positive: " + rawPageSize);
        }
        for (FlowSummary summary : client(settings).flowSummaries(pageSize, tags)) {
            out.println(summary.flowId() + "\t" + summary.name()
                + (summary.tags().isEmpty() ? "" : "\t" + String.join(",", summary.tags())));
        }
        return OK;
    }

    private static FlowApiClient client(Lf2xSettings settings) throws UsageException {
        if (settings.apiBaseUrl() == null || settings.apiBaseUrl().isBlank()) {
            throw new UsageException("--api-url or api.base_url in " + Lf2xSettings.CONFIG_FILENAME + " is required");
        }
        return FlowApiClient.fromSettings(settings);
    }

    /** Explicit options, then {@code lf2x.yaml} next to {@code --config} or in the working directory. */
    private Lf2xSettings settings(Options options) throws IOException {
        String config = options.value("--config");
        Path configPath = config != null ? workingDir.resolve(config) : null;
        String outputDir = options.value("--output-dir");
        return Lf2xSettings.builder()
            .configFile(configPath)
            .searchPaths(List.of(workingDir))
            .outputDir(outputDir != null ? Path.of(outputDir) : null)
            .apiBaseUrl(options.value("--api-url"))
            .apiToken(options.value("--token"))
            .build();
    }

    @FunctionalInterface
    interface Command {
        int call() throws IOException, UsageException;
    }

    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    /** {@code --name value} options, boolean flags and positional arguments. */
    record Options(Map<String, String> values, Set<String> flags, List<String> positionals) {

        static Options parse(String[] args, Set<String> valued, Set<String> booleans) throws UsageException {
            Map<String, String> values = new HashMap<>();
            Set<String> flags = new HashSet<>();
            List<String> positionals = new ArrayList<>();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    positionals.add(arg);
                } else if (booleans.contains(arg)) {
                    flags.add(arg);
                } else if (valued.contains(arg)) {
                    if (i + 1 >= args.length) throw new UsageException("Missing value for " + arg);
                    values.put(arg, args[++i]);
                } else {
                    throw new UsageException("Unknown option: " + arg);
                }
            }
            return new Options(values, flags, positionals);
        }

        String value(String name) {
            return values.get(name);
        }

        boolean flag(String name) {
            return flags.contains(name);
        }
    }
}
