package com.raditha.fortrace.report;

import com.raditha.fortrace.catalog.SourceProject;
import com.raditha.fortrace.model.TraceStep;
import com.raditha.fortrace.tracing.FlowTracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TraceReportExporter - summary building and CSV/JSON export.
 */
class TraceReportExporterTest {

    @TempDir
    Path tempDir;

    private TraceReportExporter exporter;

    @BeforeEach
    void setUp() {
        exporter = new TraceReportExporter();
    }

    @Test
    void testBuildReport() {
        List<TraceStep> steps = traceOf("""
                program main
                  call b
                  call b
                end program main
                subroutine b
                  call c
                end subroutine b
                subroutine c
                end subroutine c
                """);

        TraceReport report = exporter.buildReport("main", steps, false, null);

        assertEquals("main", report.startRoutine());
        assertNotNull(report.timestamp());
        assertEquals(steps.size(), report.totalSteps());
        assertEquals(2, report.maxDepth());
        assertFalse(report.truncated());
        assertFalse(report.failed());
        assertEquals(4, report.totalCalls());

        assertEquals(List.of("main", "b", "c"),
                report.routines().stream().map(TraceReport.RoutineMetrics::routine).toList());
        TraceReport.RoutineMetrics b = report.routines().get(1);
        assertEquals(2, b.entries());
        assertEquals(6, b.statements());
        assertEquals("main.f90", b.source());
    }

    @Test
    void testEmptyTrace() {
        TraceReport report = exporter.buildReport("main", List.of(), false, "Start routine not found: main");

        assertEquals(0, report.totalSteps());
        assertEquals(0, report.totalCalls());
        assertTrue(report.failed());
        assertTrue(report.routines().isEmpty());
    }

    @Test
    void testCsvExport() throws IOException {
        TraceReport report = exporter.buildReport("main", traceOf("""
                program main
                  call b
                end program main
                subroutine b
                end subroutine b
                """), true, null);

        Path csvFile = tempDir.resolve("summary.csv");
        exporter.exportToCsv(report, csvFile);

        String csv = Files.readString(csvFile);
        assertTrue(csv.contains("# Trace Summary"));
        assertTrue(csv.contains("timestamp,start_routine,total_steps,total_calls,max_depth,truncated,failure"));
        assertTrue(csv.contains(",main,5,1,1,true,"));
        assertTrue(csv.contains("# Per-Routine Metrics"));
        assertTrue(csv.contains("b,main.f90,2,1"));
    }

    @Test
    void testCsvQuotesFailureMessages() throws IOException {
        TraceReport report = exporter.buildReport("main", List.of(), false, "Routine x called by 'call x(1, 2)' not found");

        Path csvFile = tempDir.resolve("failed.csv");
        exporter.exportToCsv(report, csvFile);

        assertTrue(Files.readString(csvFile).contains("\"Routine x called by 'call x(1, 2)' not found\""));
    }

    @Test
    void testJsonExport() throws IOException {
        TraceReport report = exporter.buildReport("main", traceOf("""
                program main
                  call b
                end program main
                subroutine b
                end subroutine b
                """), false, null);

        Path jsonFile = tempDir.resolve("summary.json");
        exporter.exportToJson(report, jsonFile);

        String json = Files.readString(jsonFile);
        assertTrue(json.contains("\"startRoutine\" : \"main\""));
        assertTrue(json.contains("\"totalSteps\" : 5"));
        assertTrue(json.contains("\"routines\""));

        TraceReport read = exporter.readJson(jsonFile);
        assertEquals(report.routines(), read.routines());
        assertEquals(report.totalSteps(), read.totalSteps());
    }

    private static List<TraceStep> traceOf(String source) {
        SourceProject project = SourceProject.fromText("main.f90", source);
        List<TraceStep> steps = new ArrayList<>();
        new FlowTracer().steps(project, "main", 0).forEachRemaining(steps::add);
        return steps;
    }
}
