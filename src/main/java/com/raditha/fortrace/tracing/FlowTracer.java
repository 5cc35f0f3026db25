package com.raditha.fortrace.tracing;

import com.raditha.fortrace.catalog.RoutineSource;
import com.raditha.fortrace.classification.StatementClassifier;
import com.raditha.fortrace.classification.StatementText;
import com.raditha.fortrace.extraction.StatementReconstructor;
import com.raditha.fortrace.model.BlockEnd;
import com.raditha.fortrace.model.BlockStart;
import com.raditha.fortrace.model.BranchAlternative;
import com.raditha.fortrace.model.Call;
import com.raditha.fortrace.model.Event;
import com.raditha.fortrace.model.Goto;
import com.raditha.fortrace.model.Jump;
import com.raditha.fortrace.model.JumpTarget;
import com.raditha.fortrace.model.LogicalStatement;
import com.raditha.fortrace.model.LoopControl;
import com.raditha.fortrace.model.ModuleUse;
import com.raditha.fortrace.model.Return;
import com.raditha.fortrace.model.RoutineText;
import com.raditha.fortrace.model.Stop;
import com.raditha.fortrace.model.TraceStep;
import com.raditha.fortrace.tracing.Frame.BlockFrame;
import com.raditha.fortrace.tracing.Frame.CallFrame;
import com.raditha.fortrace.tracing.Frame.LoopFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.OptionalLong;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Follows one execution path through the source, always taking the first
 * choice at a junction.
 * <p>
 * The trace is produced lazily. Each statement is emitted before its events
 * are processed, so a statement that cannot be resolved (an unknown call
 * target, a missing label) is still part of the trace; the failure surfaces
 * as a {@link TraceException} on the following pull and the iterator is
 * exhausted afterwards. The trace ends when the start routine returns or a
 * {@code stop} is reached, and is unbounded otherwise: callers cap it.
 * <p>
 * Instances are stateless and can serve any number of independent traces.
 */
public class FlowTracer {
    private static final Logger logger = LoggerFactory.getLogger(FlowTracer.class);

    private static final Pattern ROUTINE_END = Pattern.compile("^end\\s*(?:(?:subroutine|function|program)\\b.*)?$");
    private static final Pattern FINITE_BLOCK_END = Pattern.compile("^end\\s*(?:if|select)\\b.*$");

    private final StatementReconstructor reconstructor;
    private final StatementClassifier classifier;

    public FlowTracer() {
        this(new StatementReconstructor(), new StatementClassifier());
    }

    public FlowTracer(StatementReconstructor reconstructor, StatementClassifier classifier) {
        this.reconstructor = reconstructor;
        this.classifier = classifier;
    }

    /**
     * Trace statement texts.
     *
     * @param routines     routine lookup
     * @param startRoutine routine to start in
     * @param startLine    file line (0-indexed) inside the start routine
     * @return lazy, possibly infinite sequence of statements
     * @throws TraceException           with {@link TraceError#ROUTINE_NOT_FOUND} for an unknown start routine
     * @throws IllegalArgumentException when the start line lies outside the routine
     */
    public Iterator<String> trace(RoutineSource routines, String startRoutine, int startLine) {
        Iterator<TraceStep> steps = steps(routines, startRoutine, startLine);
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return steps.hasNext();
            }

            @Override
            public String next() {
                return steps.next().statement();
            }
        };
    }

    /**
     * Trace statements together with where they were found.
     *
     * @see #trace(RoutineSource, String, int)
     */
    public Iterator<TraceStep> steps(RoutineSource routines, String startRoutine, int startLine) {
        RoutineText text = routines.lines(startRoutine)
                .orElseThrow(() -> new TraceException(TraceError.ROUTINE_NOT_FOUND,
                        "Start routine not found: " + startRoutine));
        if (startLine < text.firstLine() || startLine > text.lastLine()) {
            throw new IllegalArgumentException(String.format("Line %d is outside routine %s (lines %d-%d)",
                    startLine + 1, text.name(), text.firstLine() + 1, text.lastLine() + 1));
        }
        return new TraceIterator(routines, text, startLine);
    }

    /**
     * State of one trace: the frame stack, the statement being executed and
     * the events of that statement still to process.
     */
    private final class TraceIterator implements Iterator<TraceStep> {
        private final RoutineSource routines;
        private final Set<String> knownNames;
        private final Map<String, RoutineBody> bodies = new HashMap<>();
        private final Deque<Frame> stack = new ArrayDeque<>();
        private final Deque<Event> queue = new ArrayDeque<>();

        private RoutineBody body;
        private int current;
        private int cursor;
        private boolean finished;
        private boolean entered = true;
        private int depth;
        private TraceStep pending;

        TraceIterator(RoutineSource routines, RoutineText start, int startLine) {
            this.routines = routines;
            this.knownNames = routines.routineNames();
            this.body = load(start);
            this.cursor = body.indexOfLine(startLine);
            this.current = cursor;
            stack.push(new CallFrame(body, -1, List.of()));
            openEnclosingFrames();
        }

        @Override
        public boolean hasNext() {
            if (pending == null && !finished) {
                try {
                    pending = advance();
                } catch (TraceException e) {
                    finished = true;
                    throw e;
                }
                if (pending == null) {
                    finished = true;
                }
            }
            return pending != null;
        }

        @Override
        public TraceStep next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            TraceStep step = pending;
            pending = null;
            return step;
        }

        /**
         * Starting inside a routine means starting inside whatever blocks
         * enclose the start line: open them as if they had been entered.
         */
        private void openEnclosingFrames() {
            for (int i = 0; i < cursor; i++) {
                for (Event event : body.events(i)) {
                    if (event instanceof BlockStart start) {
                        stack.push(start.finite()
                                ? new BlockFrame(i, true)
                                : new LoopFrame(i, initialTrips(start).orElse(LoopFrame.UNBOUNDED)));
                    } else if (event instanceof BlockEnd && !(stack.peek() instanceof CallFrame)) {
                        stack.pop();
                    }
                }
            }
        }

        /**
         * Process outstanding events, then emit the next statement.
         *
         * @return the next step, or null when the trace is over
         */
        private TraceStep advance() {
            while (!finished) {
                if (!queue.isEmpty()) {
                    process(queue.poll());
                    continue;
                }
                if (cursor >= body.size()) {
                    logger.debug("Ran off the end of {}", body.name());
                    leaveRoutine();
                    continue;
                }

                current = cursor;
                cursor = current + 1;
                LogicalStatement statement = body.statement(current);
                for (Event event : body.events(current)) {
                    if (event.isStructural()) {
                        queue.add(event);
                    }
                }
                if (!statement.isEmpty()) {
                    TraceStep step = new TraceStep(body.name(), body.source(), statement.firstLine(),
                            statement.text(), depth, entered);
                    entered = false;
                    return step;
                }
            }
            return null;
        }

        private void process(Event event) {
            if (event instanceof BlockStart start) {
                openBlock(start);
            } else if (event instanceof BlockEnd end) {
                closeBlock(end);
            } else if (event instanceof BranchAlternative alternative) {
                enterAlternative(alternative);
            } else if (event instanceof Jump jump) {
                jump(jump);
            } else if (event instanceof ModuleUse use) {
                logger.debug("{} uses module {}", body.name(), use.moduleName());
            }
        }

        private void openBlock(BlockStart start) {
            if (start.finite()) {
                stack.push(new BlockFrame(current, !start.awaitsBranch()));
                return;
            }
            long trips = initialTrips(start).orElse(LoopFrame.UNBOUNDED);
            if (trips == 0) {
                logger.debug("Loop at {}:{} has no trips, skipping it", body.name(), current);
                cursor = loopEnd(current) + 1;
                return;
            }
            stack.push(new LoopFrame(current, trips));
        }

        private OptionalLong initialTrips(BlockStart start) {
            return LoopHeader.tripCount(start.statement());
        }

        /**
         * {@code end if} and {@code end select} close a block; {@code end do}
         * and the terminal statement of a labelled loop close a loop.
         */
        private void closeBlock(BlockEnd end) {
            String text = StatementText.normalize(end.statement());
            if (ROUTINE_END.matcher(text).matches()) {
                leaveRoutine();
                return;
            }
            boolean closesBlock = FINITE_BLOCK_END.matcher(text).matches();
            discardExitedFrames();
            Frame innermost = stack.peek();
            if (innermost instanceof BlockFrame && closesBlock) {
                stack.pop();
            } else if (innermost instanceof LoopFrame loop && !closesBlock) {
                finishTrip(loop, current);
            } else if (innermost instanceof CallFrame) {
                throw unbalanced("'" + end.statement() + "' closes no open block");
            } else {
                throw unbalanced("'" + end.statement() + "' does not match the innermost open "
                        + (closesBlock ? "loop" : "block"));
            }
        }

        private void enterAlternative(BranchAlternative alternative) {
            discardExitedFrames();
            Frame innermost = stack.peek();
            if (!(innermost instanceof BlockFrame block)) {
                throw unbalanced("'" + alternative.statement() + "' outside of an if or select block");
            }
            if (!block.branchTaken()) {
                stack.pop();
                stack.push(new BlockFrame(block.openIndex(), true));
                return;
            }
            int end = body.closingEnd(current + 1);
            if (end < 0) {
                throw unbalanced("Block containing '" + alternative.statement() + "' is never closed");
            }
            logger.debug("Skipping alternative at {}:{}", body.name(), current);
            // the end statement itself pops the block frame
            cursor = end;
        }

        private void jump(Jump jump) {
            JumpTarget target = jump.target();
            if (target instanceof Call call) {
                enterRoutine(call.targetName(), jump.statement());
            } else if (target instanceof Goto label) {
                cursor = body.indexOfLabel(label.labelName())
                        .orElseThrow(() -> new TraceException(TraceError.UNRESOLVED_LABEL,
                                "Label " + label.labelName() + " not found in " + body.name()));
            } else if (target instanceof LoopControl control) {
                loopControl(control, jump.statement());
            } else if (target instanceof Return) {
                leaveRoutine();
            } else if (target instanceof Stop) {
                logger.debug("Stopped in {}", body.name());
                finished = true;
            }
        }

        private void enterRoutine(String name, String statement) {
            RoutineBody callee = bodies.get(name);
            if (callee == null) {
                RoutineText text = routines.lines(name)
                        .orElseThrow(() -> new TraceException(TraceError.UNRESOLVED_CALL,
                                "Routine " + name + " called by '" + statement + "' not found"));
                callee = load(text);
            }
            logger.debug("Call {} -> {} (depth {})", body.name(), name, depth + 1);
            stack.push(new CallFrame(callee, current, new ArrayList<>(queue)));
            queue.clear();
            body = callee;
            cursor = 0;
            entered = true;
            depth++;
        }

        private RoutineBody load(RoutineText text) {
            return bodies.computeIfAbsent(text.name(),
                    n -> RoutineBody.of(text, reconstructor, classifier, knownNames));
        }

        /**
         * Pop everything up to and including the current routine's frame and
         * resume the caller, or end the trace when there is none.
         */
        private void leaveRoutine() {
            queue.clear();
            Frame frame = stack.poll();
            while (frame != null && !(frame instanceof CallFrame)) {
                frame = stack.poll();
            }
            CallFrame callee = (CallFrame) frame;

            CallFrame caller = innermostCall();
            if (callee == null || caller == null) {
                logger.debug("Trace finished in {}", body.name());
                finished = true;
                return;
            }
            logger.debug("Return {} -> {}", body.name(), caller.body().name());
            body = caller.body();
            depth--;
            current = callee.returnIndex();
            cursor = current + 1;
            queue.addAll(callee.pendingEvents());
        }

        private void loopControl(LoopControl control, String statement) {
            discardExitedFrames();
            LoopFrame loop = innermostLoop();
            if (loop == null) {
                throw unbalanced("'" + statement + "' outside of a loop");
            }
            while (stack.peek() != loop) {
                stack.pop();
            }
            int end = loopEnd(loop.headerIndex());
            if (control.leavesLoop()) {
                stack.pop();
                cursor = end + 1;
            } else {
                finishTrip(loop, end);
            }
        }

        /**
         * One trip of the innermost loop is over: go round again or fall out.
         * Going round drops whatever the end statement still had to do, such
         * as closing the outer loops of a shared labelled terminal.
         */
        private void finishTrip(LoopFrame loop, int endIndex) {
            stack.pop();
            if (loop.hasAnotherTrip()) {
                stack.push(loop.nextTrip());
                queue.clear();
                cursor = loop.headerIndex() + 1;
            } else {
                cursor = endIndex + 1;
            }
        }

        /**
         * A goto leaves the frame stack alone, so frames of constructs it
         * jumped out of can sit above the one the current statement is in.
         * Drop them, up to the current routine's frame.
         */
        private void discardExitedFrames() {
            while (!(stack.peek() instanceof CallFrame) && !encloses(stack.peek(), current)) {
                logger.debug("Discarding exited {} in {}", stack.peek(), body.name());
                stack.pop();
            }
        }

        /**
         * Whether a statement lies inside a block or loop, header excluded
         * and closing statement included. A construct that never closes
         * encloses everything after its header.
         */
        private boolean encloses(Frame frame, int index) {
            int open = frame instanceof LoopFrame loop ? loop.headerIndex() : ((BlockFrame) frame).openIndex();
            int end = body.closingEnd(open + 1);
            return index > open && (end < 0 || index <= end);
        }

        private int loopEnd(int headerIndex) {
            int end = body.closingEnd(headerIndex + 1);
            if (end < 0) {
                throw unbalanced("Loop '" + body.statement(headerIndex).text() + "' is never closed");
            }
            return end;
        }

        private LoopFrame innermostLoop() {
            for (Frame frame : stack) {
                if (frame instanceof LoopFrame loop) {
                    return loop;
                }
                if (frame instanceof CallFrame) {
                    return null;
                }
            }
            return null;
        }

        private CallFrame innermostCall() {
            for (Frame frame : stack) {
                if (frame instanceof CallFrame call) {
                    return call;
                }
            }
            return null;
        }

        private TraceException unbalanced(String message) {
            return new TraceException(TraceError.UNBALANCED_BLOCK, message + " in " + body.name());
        }
    }
}
