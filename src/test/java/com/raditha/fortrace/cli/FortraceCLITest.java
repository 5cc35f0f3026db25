package com.raditha.fortrace.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FortraceCLITest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outContent;
    private ByteArrayOutputStream errContent;
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUp() {
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void testTraceFromMainProgram() throws Exception {
        int exitCode = FortraceCLI.createCommandLine().execute(fixture("solver.f90"), fixture("lib.f90"));

        assertEquals(0, exitCode, errContent.toString());
        List<String> lines = outContent.toString().lines().toList();
        assertEquals(37, lines.size());
        assertEquals("program solver", lines.get(0));
        assertEquals("call setup", lines.get(4));
        assertEquals("subroutine setup", lines.get(5));
        assertEquals("print *, 'done'", lines.get(33));
        assertEquals("end program solver", lines.get(36));
        assertFalse(lines.contains("print *, 'later'"));
        assertFalse(lines.contains("print *, 'not converged'"));
    }

    @Test
    void testTraceFromDirectory() throws Exception {
        Path dir = Path.of(fixture("solver.f90")).getParent();
        Path copy = tempDir.resolve("src");
        Files.createDirectories(copy);
        Files.copy(dir.resolve("solver.f90"), copy.resolve("solver.f90"));
        Files.copy(dir.resolve("lib.f90"), copy.resolve("lib.f90"));

        int exitCode = FortraceCLI.createCommandLine().execute(copy.toString());

        assertEquals(0, exitCode, errContent.toString());
        assertEquals(37, outContent.toString().lines().count());
    }

    @Test
    void testStartRoutineAndLine() throws Exception {
        int exitCode = FortraceCLI.createCommandLine().execute("-r", "STEP", "--line", "13",
                fixture("solver.f90"), fixture("lib.f90"));

        assertEquals(0, exitCode, errContent.toString());
        assertEquals(List.of("print *, 'first'", "case default", "end select", "end subroutine step"),
                outContent.toString().lines().toList());
    }

    @Test
    void testLocations() throws Exception {
        int exitCode = FortraceCLI.createCommandLine().execute("--locations", "-n", "7",
                fixture("solver.f90"), fixture("lib.f90"));

        assertEquals(0, exitCode, errContent.toString());
        List<String> lines = outContent.toString().lines().toList();
        assertTrue(lines.get(0).contains("solver.f90:1"));
        assertTrue(lines.get(0).endsWith(" program solver"));
        assertTrue(lines.get(5).contains("lib.f90:5"));
        assertTrue(lines.get(5).endsWith("   subroutine setup"));
    }

    @Test
    void testMaxStepsTruncates() throws Exception {
        int exitCode = FortraceCLI.createCommandLine().execute("--max-steps", "5",
                fixture("solver.f90"), fixture("lib.f90"));

        assertEquals(0, exitCode);
        assertEquals(5, outContent.toString().lines().count());
        assertTrue(errContent.toString().contains("Trace stopped after 5 statements"));
    }

    @Test
    void testJsonFormat() throws Exception {
        int exitCode = FortraceCLI.createCommandLine().execute("--format", "json",
                fixture("solver.f90"), fixture("lib.f90"));

        assertEquals(0, exitCode, errContent.toString());
        JsonNode json = new ObjectMapper().readTree(outContent.toString());
        assertEquals("solver", json.get("startRoutine").asText());
        assertEquals(37, json.get("steps").asInt());
        assertFalse(json.get("truncated").asBoolean());
        assertTrue(json.get("error").isNull());

        JsonNode first = json.get("trace").get(0);
        assertEquals("program solver", first.get("statement").asText());
        assertEquals(1, first.get("line").asInt());
        assertEquals(0, first.get("depth").asInt());
        assertEquals(1, json.get("trace").get(5).get("depth").asInt());
    }

    @Test
    void testCatalog() throws Exception {
        int exitCode = FortraceCLI.createCommandLine().execute("--catalog", fixture("solver.f90"), fixture("lib.f90"));

        assertEquals(0, exitCode, errContent.toString());
        String output = outContent.toString();
        assertTrue(output.contains("PROGRAM solver"));
        assertTrue(output.contains("program solver [L1-14]"));
        assertTrue(output.contains("MODULE constants"));
        assertTrue(output.contains("setup [L5-7]"));
        assertTrue(output.contains("step [L9-17]"));
        assertTrue(output.contains("converged [L19-21]"));
    }

    @Test
    void testCatalogAsJson() throws Exception {
        int exitCode = FortraceCLI.createCommandLine().execute("--catalog", "--format", "json", fixture("lib.f90"));

        assertEquals(0, exitCode, errContent.toString());
        JsonNode files = new ObjectMapper().readTree(outContent.toString());
        assertEquals(1, files.size());
        assertEquals("MODULE", files.get(0).get("kind").asText());
        assertEquals(3, files.get(0).get("routines").size());
        assertEquals(9, files.get(0).get("routines").get(1).get("startLine").asInt());
    }

    @Test
    void testExportBoth() throws Exception {
        Path out = tempDir.resolve("reports");
        int exitCode = FortraceCLI.createCommandLine().execute("--export", "both", "--output", out.toString(),
                fixture("solver.f90"), fixture("lib.f90"));

        assertEquals(0, exitCode, errContent.toString());
        assertTrue(Files.exists(out.resolve("trace-summary.csv")));
        assertTrue(Files.exists(out.resolve("trace-summary.json")));
        assertTrue(Files.readString(out.resolve("trace-summary.csv")).contains("# Per-Routine Metrics"));
        assertTrue(errContent.toString().contains("Summary exported to:"));
    }

    @Test
    void testConfigFileSetsStepLimit() throws Exception {
        Path config = tempDir.resolve("fortrace.yml");
        Files.writeString(config, """
                fortrace:
                  max_steps: 3
                """);

        int exitCode = FortraceCLI.createCommandLine().execute("--config-file", config.toString(),
                fixture("solver.f90"), fixture("lib.f90"));

        assertEquals(0, exitCode, errContent.toString());
        assertEquals(3, outContent.toString().lines().count());
    }

    @Test
    void testCliStepLimitBeatsConfigFile() throws Exception {
        Path config = tempDir.resolve("fortrace.yml");
        Files.writeString(config, """
                fortrace:
                  max_steps: 3
                """);

        int exitCode = FortraceCLI.createCommandLine().execute("--config-file", config.toString(), "-n", "6",
                fixture("solver.f90"), fixture("lib.f90"));

        assertEquals(0, exitCode, errContent.toString());
        assertEquals(6, outContent.toString().lines().count());
    }

    /**
     * Any step limit below the full trace length prints exactly that many statements.
     */
    @Property(tries = 20)
    void stepLimitIsHonoured(@ForAll @IntRange(min = 1, max = 37) int limit) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        PrintStream previous = System.out;
        System.setOut(new PrintStream(out));
        try {
            int exitCode = FortraceCLI.createCommandLine().execute("-n", String.valueOf(limit),
                    fixture("solver.f90"), fixture("lib.f90"));
            assertEquals(0, exitCode);
        } finally {
            System.setOut(previous);
        }
        assertEquals(limit, out.toString().lines().count());
    }

    @Property(tries = 10)
    void outputFormatRoundTrip(@ForAll("formats") OutputFormat format) {
        assertEquals(format, OutputFormat.fromString(format.toCliString()));
        assertEquals(format, OutputFormat.fromString(format.toCliString().toUpperCase()));
    }

    @Provide
    Arbitrary<OutputFormat> formats() {
        return Arbitraries.of(OutputFormat.class);
    }

    static String fixture(String name) throws URISyntaxException {
        return Path.of(FortraceCLITest.class.getResource("/fortran/" + name).toURI()).toString();
    }
}
