package com.raditha.fortrace.catalog;

import com.raditha.fortrace.model.RoutineEntry;
import com.raditha.fortrace.model.RoutineText;
import com.raditha.fortrace.model.SourceUnit;

import java.util.List;

/**
 * One loaded file: its immutable lines and their catalog.
 *
 * @param name  display name, usually the file name
 * @param lines file content, one entry per line
 * @param unit  catalog built from {@code lines}
 */
public record SourceFile(
        String name,
        List<String> lines,
        SourceUnit unit) {

    public SourceFile {
        lines = List.copyOf(lines);
    }

    /**
     * View of the lines of one routine of this file.
     */
    public RoutineText slice(RoutineEntry entry) {
        return new RoutineText(entry.name(), name, entry.startLine(),
                lines.subList(entry.startLine(), entry.endLine() + 1));
    }
}
