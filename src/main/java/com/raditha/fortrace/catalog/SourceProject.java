package com.raditha.fortrace.catalog;

import com.raditha.fortrace.config.TraceConfig;
import com.raditha.fortrace.model.RoutineEntry;
import com.raditha.fortrace.model.RoutineText;
import com.raditha.fortrace.model.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The set of loaded source files, resolving routine names across all of them.
 * <p>
 * When two files define the same routine the file loaded first wins.
 * Main programs can be traced but are not callable, so they are left out of
 * {@link #routineNames()}.
 */
public class SourceProject implements RoutineSource {
    private static final Logger logger = LoggerFactory.getLogger(SourceProject.class);

    private final RoutineCatalogBuilder catalogBuilder = new RoutineCatalogBuilder();
    private final List<SourceFile> files = new ArrayList<>();
    private final Map<String, Located> routines = new LinkedHashMap<>();
    private final Map<String, Located> programs = new LinkedHashMap<>();

    /**
     * Load every source file named by {@code inputs}. Directories are walked
     * for files with one of the configured extensions.
     *
     * @param inputs files or directories
     * @param config charset, extensions and exclusion patterns
     * @return the loaded project
     * @throws IOException when a file cannot be read
     */
    public static SourceProject load(List<Path> inputs, TraceConfig config) throws IOException {
        SourceProject project = new SourceProject();
        for (Path input : inputs) {
            for (Path file : discover(input, config)) {
                List<String> lines = Files.readAllLines(file, config.charset());
                project.addFile(file.toString(), lines);
            }
        }
        logger.info("Loaded {} files with {} routines", project.files.size(), project.routines.size());
        return project;
    }

    /**
     * Project holding one file given as text, mostly for tests and tooling.
     */
    public static SourceProject fromText(String name, String text) {
        SourceProject project = new SourceProject();
        project.addFile(name, text.lines().toList());
        return project;
    }

    private static List<Path> discover(Path input, TraceConfig config) throws IOException {
        if (!Files.isDirectory(input)) {
            return List.of(input);
        }
        try (Stream<Path> walk = Files.walk(input)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> config.isSourceFile(p.getFileName().toString()))
                    .filter(p -> !config.shouldExclude(input.relativize(p).toString().replace('\\', '/')))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Catalog a file and register its routines.
     *
     * @return the catalogued file
     */
    public SourceFile addFile(String name, List<String> lines) {
        SourceUnit unit = catalogBuilder.build(lines);
        SourceFile file = new SourceFile(name, lines, unit);
        files.add(file);

        for (RoutineEntry entry : unit.routines()) {
            register(routines, file, entry);
        }
        unit.mainProgram().ifPresent(entry -> register(programs, file, entry));

        logger.info("{}: {} {} with {} routines", name, unit.kind(), unit.name().orElse("(unnamed)"),
                unit.routines().size());
        return file;
    }

    private static void register(Map<String, Located> index, SourceFile file, RoutineEntry entry) {
        Located previous = index.get(entry.name());
        if (previous == null) {
            index.put(entry.name(), new Located(file, entry));
        } else if (previous.file() != file) {
            logger.warn("Routine {} in {} ignored, already defined in {}", entry.name(), file.name(),
                    previous.file().name());
        } else {
            // redefinition inside one file: the later one wins, as in the file's own catalog
            index.put(entry.name(), new Located(file, entry));
        }
    }

    @Override
    public Optional<RoutineText> lines(String routineName) {
        String key = routineName.toLowerCase(Locale.ROOT);
        Located located = routines.get(key);
        if (located == null) {
            located = programs.get(key);
        }
        return Optional.ofNullable(located).map(l -> l.file().slice(l.entry()));
    }

    @Override
    public Set<String> routineNames() {
        return Collections.unmodifiableSet(routines.keySet());
    }

    /**
     * Locate a routine or main program by name.
     */
    public Optional<RoutineEntry> findEntry(String routineName) {
        String key = routineName.toLowerCase(Locale.ROOT);
        Located located = routines.containsKey(key) ? routines.get(key) : programs.get(key);
        return Optional.ofNullable(located).map(Located::entry);
    }

    /**
     * First main program found, the natural place to start a trace.
     */
    public Optional<RoutineEntry> defaultEntry() {
        return programs.values().stream().findFirst().map(Located::entry);
    }

    public List<SourceFile> files() {
        return Collections.unmodifiableList(files);
    }

    private record Located(SourceFile file, RoutineEntry entry) {
    }
}
