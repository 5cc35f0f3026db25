package com.raditha.fortrace.report;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Summary of one trace.
 *
 * @param startRoutine routine the trace started in
 * @param timestamp    when the trace was taken
 * @param totalSteps   statements emitted
 * @param truncated    true when the step cap cut the trace short
 * @param maxDepth     deepest call depth reached
 * @param failure      message of the error that ended the trace, or null
 * @param routines     per-routine figures in order of first visit
 */
public record TraceReport(
        String startRoutine,
        LocalDateTime timestamp,
        int totalSteps,
        boolean truncated,
        int maxDepth,
        String failure,
        List<RoutineMetrics> routines) {

    public boolean failed() {
        return failure != null;
    }

    public int totalCalls() {
        return routines.stream().mapToInt(RoutineMetrics::entries).sum() - (totalSteps > 0 ? 1 : 0);
    }

    /**
     * Figures for one routine.
     *
     * @param routine    routine name
     * @param source     file holding the routine
     * @param statements statements of the routine in the trace
     * @param entries    times the trace entered the routine
     */
    public record RoutineMetrics(
            String routine,
            String source,
            int statements,
            int entries) {
    }
}
