package com.raditha.fortrace.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.fortrace.model.TraceStep;
import com.raditha.fortrace.report.TraceReport.RoutineMetrics;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summarises traces and exports the summary to CSV and JSON for later
 * comparison between runs.
 */
public class TraceReportExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Build the summary of a trace.
     *
     * @param startRoutine routine the trace started in
     * @param steps        the statements emitted, in order
     * @param truncated    whether the step cap ended the trace
     * @param failure      message of the error that ended the trace, or null
     */
    public TraceReport buildReport(String startRoutine, List<TraceStep> steps, boolean truncated, String failure) {
        Map<String, int[]> counts = new LinkedHashMap<>();
        Map<String, String> sources = new LinkedHashMap<>();
        int maxDepth = 0;

        for (TraceStep step : steps) {
            int[] routine = counts.computeIfAbsent(step.routine(), k -> new int[2]);
            sources.putIfAbsent(step.routine(), step.source());
            routine[0]++;
            if (step.entry()) {
                routine[1]++;
            }
            maxDepth = Math.max(maxDepth, step.depth());
        }

        List<RoutineMetrics> routines = counts.entrySet().stream()
                .map(e -> new RoutineMetrics(e.getKey(), sources.get(e.getKey()), e.getValue()[0], e.getValue()[1]))
                .toList();

        return new TraceReport(
                startRoutine,
                LocalDateTime.now(),
                steps.size(),
                truncated,
                maxDepth,
                failure,
                routines);
    }

    /**
     * Export a summary to CSV format.
     */
    public void exportToCsv(TraceReport report, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        csv.append("# Trace Summary\n");
        csv.append("timestamp,start_routine,total_steps,total_calls,max_depth,truncated,failure\n");
        csv.append(String.format("%s,%s,%d,%d,%d,%b,%s%n",
                report.timestamp().format(TIMESTAMP_FORMAT),
                report.startRoutine(),
                report.totalSteps(),
                report.totalCalls(),
                report.maxDepth(),
                report.truncated(),
                report.failed() ? quote(report.failure()) : ""));

        csv.append("\n");

        csv.append("# Per-Routine Metrics\n");
        csv.append("routine,source,statements,entries\n");
        for (RoutineMetrics routine : report.routines()) {
            csv.append(String.format("%s,%s,%d,%d%n",
                    routine.routine(),
                    quote(routine.source()),
                    routine.statements(),
                    routine.entries()));
        }

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Export a summary to JSON format.
     */
    public void exportToJson(TraceReport report, Path outputPath) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), report);
    }

    /**
     * Read back a summary written by {@link #exportToJson}.
     */
    public TraceReport readJson(Path inputPath) throws IOException {
        return mapper.readValue(inputPath.toFile(), TraceReport.class);
    }

    private static String quote(String value) {
        if (value.contains(",") || value.contains("\"")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
