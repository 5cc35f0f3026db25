package com.raditha.fortrace.tracing;

import com.raditha.fortrace.model.Event;

import java.util.List;

/**
 * One entry of the tracer's open-structure stack.
 */
sealed interface Frame {

    /**
     * An open {@code if} or {@code select} block.
     *
     * @param openIndex   statement index of the {@code if} or {@code select}
     * @param branchTaken whether the branch being executed has been entered
     */
    record BlockFrame(int openIndex, boolean branchTaken) implements Frame {
    }

    /**
     * An open {@code do} loop.
     *
     * @param headerIndex    statement index of the {@code do}
     * @param remainingTrips trips left including the current one, or {@link #UNBOUNDED}
     */
    record LoopFrame(int headerIndex, long remainingTrips) implements Frame {
        static final long UNBOUNDED = -1;

        boolean hasAnotherTrip() {
            return remainingTrips == UNBOUNDED || remainingTrips > 1;
        }

        LoopFrame nextTrip() {
            return remainingTrips == UNBOUNDED ? this : new LoopFrame(headerIndex, remainingTrips - 1);
        }
    }

    /**
     * A routine being executed.
     *
     * @param body          the routine
     * @param returnIndex   statement index in the caller to resume after, -1 for the start routine
     * @param pendingEvents events of the calling statement still to process on return
     */
    record CallFrame(RoutineBody body, int returnIndex, List<Event> pendingEvents) implements Frame {
    }
}
