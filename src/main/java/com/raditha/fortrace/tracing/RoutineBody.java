package com.raditha.fortrace.tracing;

import com.raditha.fortrace.classification.StatementClassifier;
import com.raditha.fortrace.classification.StatementText;
import com.raditha.fortrace.extraction.StatementReconstructor;
import com.raditha.fortrace.model.BlockEnd;
import com.raditha.fortrace.model.BlockStart;
import com.raditha.fortrace.model.Event;
import com.raditha.fortrace.model.LogicalStatement;
import com.raditha.fortrace.model.RoutineText;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A routine's statements with their events, reconstructed and classified
 * once per trace.
 */
final class RoutineBody {

    private final RoutineText text;
    private final List<LogicalStatement> statements;
    private final List<List<Event>> events;
    private final Map<Integer, Integer> closingEnds = new HashMap<>();

    private RoutineBody(RoutineText text, List<LogicalStatement> statements, List<List<Event>> events) {
        this.text = text;
        this.statements = statements;
        this.events = events;
    }

    static RoutineBody of(RoutineText text, StatementReconstructor reconstructor,
                          StatementClassifier classifier, Set<String> knownNames) {
        List<LogicalStatement> statements = new ArrayList<>();
        List<List<Event>> events = new ArrayList<>();
        Deque<String> openLabels = new ArrayDeque<>();
        Iterator<LogicalStatement> it = reconstructor.statements(text.lines(), text.firstLine());
        while (it.hasNext()) {
            LogicalStatement statement = it.next();
            statements.add(statement);
            events.add(closeLabelledLoops(statement.text(),
                    classifier.classify(statement.text(), knownNames), openLabels));
        }
        return new RoutineBody(text, statements, events);
    }

    /**
     * A labelled {@code do} ends at the statement carrying its label. That
     * statement gets one extra {@link BlockEnd} per loop it terminates,
     * after its own events, unless it is an {@code end do} already.
     *
     * @param openLabels terminal labels of the open labelled loops, innermost first
     */
    private static List<Event> closeLabelledLoops(String statement, List<Event> classified,
                                                  Deque<String> openLabels) {
        List<Event> result = new ArrayList<>(classified);
        Optional<String> own = StatementText.label(statement);
        if (own.isPresent()) {
            boolean endsItself = classified.stream().anyMatch(BlockEnd.class::isInstance);
            while (!openLabels.isEmpty() && StatementText.sameLabel(openLabels.peek(), own.get())) {
                openLabels.pop();
                if (endsItself) {
                    endsItself = false;
                } else {
                    // keep the plain event last
                    result.add(result.size() - 1, new BlockEnd(statement));
                }
            }
        }
        for (Event event : classified) {
            if (event instanceof BlockStart start && !start.finite()) {
                LoopHeader.terminalLabel(start.statement()).ifPresent(openLabels::push);
            }
        }
        return result;
    }

    String name() {
        return text.name();
    }

    String source() {
        return text.source();
    }

    int size() {
        return statements.size();
    }

    LogicalStatement statement(int index) {
        return statements.get(index);
    }

    List<Event> events(int index) {
        return events.get(index);
    }

    boolean containsLine(int fileLine) {
        return fileLine >= text.firstLine() && fileLine <= text.lastLine();
    }

    /**
     * Index of the statement a file line belongs to. Lines that belong to no
     * statement map to the next statement after them.
     */
    int indexOfLine(int fileLine) {
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i).lastLine() >= fileLine) {
                return i;
            }
        }
        return statements.size();
    }

    /**
     * Index of the statement carrying a numeric label.
     */
    Optional<Integer> indexOfLabel(String label) {
        for (int i = 0; i < statements.size(); i++) {
            Optional<String> own = StatementText.label(statements.get(i).text());
            if (own.isPresent() && StatementText.sameLabel(own.get(), label)) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }

    /**
     * Index of the end statement closing the block that is open at {@code from}.
     *
     * @param from first statement index inside the block
     * @return the closing statement's index, or -1 when the block never closes
     */
    int closingEnd(int from) {
        return closingEnds.computeIfAbsent(from, this::findClosingEnd);
    }

    private int findClosingEnd(int from) {
        int depth = 1;
        for (int i = from; i < statements.size(); i++) {
            for (Event event : events.get(i)) {
                if (event instanceof BlockStart) {
                    depth++;
                } else if (event instanceof BlockEnd) {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                }
            }
        }
        return -1;
    }
}
