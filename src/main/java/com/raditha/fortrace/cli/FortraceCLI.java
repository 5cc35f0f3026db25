package com.raditha.fortrace.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.fortrace.catalog.SourceFile;
import com.raditha.fortrace.catalog.SourceProject;
import com.raditha.fortrace.config.Settings;
import com.raditha.fortrace.config.TraceConfig;
import com.raditha.fortrace.config.TraceSettings;
import com.raditha.fortrace.model.RoutineEntry;
import com.raditha.fortrace.model.SourceUnit;
import com.raditha.fortrace.model.TraceStep;
import com.raditha.fortrace.report.TraceReport;
import com.raditha.fortrace.report.TraceReportExporter;
import com.raditha.fortrace.tracing.FlowTracer;
import com.raditha.fortrace.tracing.TraceError;
import com.raditha.fortrace.tracing.TraceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the flow tracer.
 * <p>
 * Usage:
 * java -jar fortrace.jar [options] &lt;file-or-directory&gt;...
 * <p>
 * Configuration priority: CLI arguments > fortrace.yml > defaults
 */
@Command(name = "fortrace", mixinStandardHelpOptions = true, version = "Fortrace v1.0.0",
        description = "Traces one execution path through Fortran sources")
@SuppressWarnings("java:S106")
public class FortraceCLI implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(FortraceCLI.class);

    static final int EXIT_CONFIGURATION = 2;
    static final int EXIT_IO = 3;
    static final int EXIT_TRACE = 4;

    private static final ObjectMapper mapper = new ObjectMapper();

    @Parameters(arity = "1..*", paramLabel = "<file-or-directory>", description = "Source files or directories to load")
    private List<Path> inputs = new ArrayList<>();

    @Option(names = {"-r", "--routine"}, description = "Start routine (default: the main program)", paramLabel = "<name>")
    private String routine;

    @Option(names = {"-l", "--line"}, description = "1-based file line to start at (default: the routine's first line)",
            paramLabel = "<n>")
    private int line = 0; // 0 = routine's first line

    @Option(names = {"-n", "--max-steps"}, description = "Maximum statements to trace (default: 1000)",
            paramLabel = "<n>")
    private int maxSteps = 0; // 0 = use YAML/default

    @Option(names = "--format", description = "Trace output: ${COMPLETION-CANDIDATES}", paramLabel = "<format>",
            converter = OutputFormatConverter.class)
    private OutputFormat format = OutputFormat.TEXT;

    @Option(names = "--locations", description = "Prefix each statement with file:line and indent by call depth")
    private boolean locations = false;

    @Option(names = "--catalog", description = "Print the routines found instead of tracing")
    private boolean catalog = false;

    @Option(names = "--export", description = "Export a trace summary (csv, json, or both)", paramLabel = "<format>")
    private String exportFormat;

    @Option(names = "--output", description = "Directory for exported summaries", paramLabel = "<path>")
    private String outputPath;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--charset", description = "Source file charset (default: UTF-8)", paramLabel = "<name>")
    private String charset;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        if (configFile != null) {
            Settings.loadConfigMap(new File(configFile));
        } else {
            Settings.loadConfigMap();
        }
        TraceConfig config = TraceSettings.loadConfig(maxSteps, charset);

        SourceProject project = SourceProject.load(inputs, config);
        if (catalog) {
            printCatalog(project);
        } else {
            runTrace(project, config);
        }
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the exit code mapping installed.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new FortraceCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof TraceException trace) {
                commandLine.getErr().println("Trace error (" + trace.getError() + "): " + ex.getMessage());
                return EXIT_TRACE;
            } else if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIGURATION;
            } else if (ex instanceof IOException || ex instanceof UncheckedIOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return EXIT_CONFIGURATION;
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("Max-steps must be positive, got: " + maxSteps);
        }
        if (line < 0) {
            throw new IllegalArgumentException("Line must be positive, got: " + line);
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            String export = exportFormat.toLowerCase();
            if (!export.equals("csv") && !export.equals("json") && !export.equals("both")) {
                throw new IllegalArgumentException(
                        "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
            }
        }

        if (catalog && exportFormat != null) {
            throw new IllegalArgumentException("Cannot export a summary when printing the catalog");
        }

        if (configFile != null && !new File(configFile).exists()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        if (outputPath != null) {
            File outputDir = new File(outputPath);
            if (outputDir.exists() && !outputDir.isDirectory()) {
                throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
            }
            if (!outputDir.exists() && !outputDir.mkdirs()) {
                throw new IllegalArgumentException("Cannot create output directory: " + outputPath);
            }
        }
    }

    private void runTrace(SourceProject project, TraceConfig config) throws IOException {
        RoutineEntry start = resolveStart(project);
        int startLine = line > 0 ? line - 1 : start.startLine();

        List<TraceStep> steps = new ArrayList<>();
        boolean truncated = false;
        TraceException failure = null;
        try {
            Iterator<TraceStep> trace = new FlowTracer().steps(project, start.name(), startLine);
            while (steps.size() < config.maxSteps() && trace.hasNext()) {
                steps.add(trace.next());
            }
            truncated = steps.size() == config.maxSteps() && hasMore(trace);
        } catch (TraceException e) {
            failure = e;
        }
        logger.info("Traced {} statements from {}{}", steps.size(), start.name(), truncated ? " (truncated)" : "");

        if (format == OutputFormat.JSON) {
            printJsonTrace(start, steps, truncated, failure);
        } else {
            printTextTrace(steps, truncated);
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            exportSummary(start.name(), steps, truncated, failure);
        }

        if (failure != null) {
            throw failure;
        }
    }

    private RoutineEntry resolveStart(SourceProject project) {
        if (routine != null) {
            return project.findEntry(routine)
                    .orElseThrow(() -> new TraceException(TraceError.ROUTINE_NOT_FOUND,
                            "Start routine not found: " + routine));
        }
        return project.defaultEntry()
                .orElseThrow(() -> new IllegalArgumentException(
                        "No main program found, name a start routine with --routine"));
    }

    private static boolean hasMore(Iterator<TraceStep> trace) {
        try {
            return trace.hasNext();
        } catch (TraceException e) {
            logger.debug("Trace would fail after the step limit: {}", e.getMessage());
            return true;
        }
    }

    private void printTextTrace(List<TraceStep> steps, boolean truncated) {
        for (TraceStep step : steps) {
            if (locations) {
                System.out.printf("%-24s %s%s%n", step.toLocationString(), "  ".repeat(step.depth()),
                        step.statement());
            } else {
                System.out.println(step.statement());
            }
        }
        if (truncated) {
            System.err.printf("Trace stopped after %d statements%n", steps.size());
        }
    }

    private static void printJsonTrace(RoutineEntry start, List<TraceStep> steps, boolean truncated,
                                       TraceException failure) throws IOException {
        List<StepDTO> stepDTOs = steps.stream()
                .map(s -> new StepDTO(s.routine(), s.source(), s.line() + 1, s.depth(), s.statement()))
                .toList();
        TraceDTO trace = new TraceDTO(start.name(), steps.size(), truncated,
                failure == null ? null : failure.getError().name(),
                failure == null ? null : failure.getMessage(),
                stepDTOs);
        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(trace));
    }

    private void printCatalog(SourceProject project) throws IOException {
        if (format == OutputFormat.JSON) {
            List<FileDTO> files = project.files().stream()
                    .map(FortraceCLI::toFileDTO)
                    .toList();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(files));
            return;
        }

        for (SourceFile file : project.files()) {
            SourceUnit unit = file.unit();
            System.out.printf("%s: %s%s%n", file.name(), unit.kind(), unit.name().map(n -> " " + n).orElse(""));
            unit.mainProgram().ifPresent(p -> System.out.println("  program " + p.toDisplayString()));
            for (RoutineEntry entry : unit.routines()) {
                System.out.println("  " + entry.toDisplayString());
            }
        }
    }

    private static FileDTO toFileDTO(SourceFile file) {
        SourceUnit unit = file.unit();
        return new FileDTO(
                file.name(),
                unit.kind().name(),
                unit.name().orElse(null),
                unit.mainProgram().map(FortraceCLI::toRoutineDTO).orElse(null),
                unit.routines().stream().map(FortraceCLI::toRoutineDTO).toList());
    }

    private static RoutineDTO toRoutineDTO(RoutineEntry entry) {
        return new RoutineDTO(entry.name(), entry.startLine() + 1, entry.endLine() + 1);
    }

    /**
     * Export the trace summary to CSV/JSON files.
     */
    private void exportSummary(String startRoutine, List<TraceStep> steps, boolean truncated,
                               TraceException failure) throws IOException {
        TraceReportExporter exporter = new TraceReportExporter();
        TraceReport report = exporter.buildReport(startRoutine, steps, truncated,
                failure == null ? null : failure.getMessage());

        Path outputDir = outputPath != null
                ? Paths.get(outputPath)
                : Paths.get(".");
        String export = exportFormat.toLowerCase();

        if ("csv".equals(export) || "both".equals(export)) {
            Path csvPath = outputDir.resolve("trace-summary.csv");
            exporter.exportToCsv(report, csvPath);
            System.err.println("Summary exported to: " + csvPath.toAbsolutePath());
        }

        if ("json".equals(export) || "both".equals(export)) {
            Path jsonPath = outputDir.resolve("trace-summary.json");
            exporter.exportToJson(report, jsonPath);
            System.err.println("Summary exported to: " + jsonPath.toAbsolutePath());
        }
    }

    public record TraceDTO(String startRoutine, int steps, boolean truncated, String error, String message,
                    List<StepDTO> trace) {
    }

    public record StepDTO(String routine, String source, int line, int depth, String statement) {
    }

    public record FileDTO(String file, String kind, String name, RoutineDTO program, List<RoutineDTO> routines) {
    }

    public record RoutineDTO(String name, int startLine, int endLine) {
    }

    /**
     * Custom converter for OutputFormat enum to handle CLI string values.
     */
    public static class OutputFormatConverter implements ITypeConverter<OutputFormat> {
        @Override
        public OutputFormat convert(String value) throws Exception {
            return OutputFormat.fromString(value);
        }
    }
}
