package com.raditha.fortrace.classification;

import com.raditha.fortrace.model.BlockEnd;
import com.raditha.fortrace.model.BlockStart;
import com.raditha.fortrace.model.BranchAlternative;
import com.raditha.fortrace.model.Call;
import com.raditha.fortrace.model.Event;
import com.raditha.fortrace.model.Goto;
import com.raditha.fortrace.model.Jump;
import com.raditha.fortrace.model.LoopControl;
import com.raditha.fortrace.model.ModuleUse;
import com.raditha.fortrace.model.PlainStatement;
import com.raditha.fortrace.model.Return;
import com.raditha.fortrace.model.Stop;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps a logical statement to its control-flow events.
 * <p>
 * Events come out in a fixed order: one call per embedded function reference
 * to a known routine (left to right), then every primary rule that matches in
 * table order, then a {@link PlainStatement} carrying the whole statement.
 * Classification never fails; any input yields at least the plain event.
 * <p>
 * A logical {@code if} (no {@code then}) opens no block. Its action statement
 * is classified instead, which amounts to always taking the branch.
 */
public class StatementClassifier {

    /**
     * Identifier (letters, digits, underscore, percent) directly followed by an
     * opening parenthesis.
     */
    private static final Pattern FUNCTION_REFERENCE = Pattern.compile("([0-9a-z_%]+)\\s*\\(");

    /**
     * Keywords after which a name followed by parentheses is not a function
     * reference: the target of a call statement and routine headers.
     */
    private static final Pattern NOT_A_REFERENCE = Pattern.compile("\\b(?:call|subroutine|function)\\s*$");

    private static final Pattern LOGICAL_IF = Pattern.compile("^if\\s*\\(");

    private static final List<ClassificationRule> PRIMARY_RULES = List.of(
            ClassificationRule.of("block-if", "^if\\s*\\(.*\\)\\s*then$",
                    (statement, m) -> new BlockStart(statement, true)),
            ClassificationRule.of("select", "^select\\s*(?:case|type|rank)\\s*\\(",
                    (statement, m) -> new BlockStart(statement, true, true)),
            ClassificationRule.of("do", "^do(?:\\s+(?!=).*)?$",
                    (statement, m) -> new BlockStart(statement, false)),
            ClassificationRule.of("call", "^call\\s+([0-9a-z_%]+)",
                    (statement, m) -> new Jump(statement, new Call(m.group(1)))),
            ClassificationRule.of("goto", "^go\\s*to\\s*(\\d+)\\s*$",
                    (statement, m) -> new Jump(statement, new Goto(m.group(1)))),
            ClassificationRule.of("else", "^else(?!\\s*where)(?:\\s*if\\s*\\(.*\\)\\s*then(?:\\s+[a-z_]\\w*)?|\\s+[a-z_]\\w*)?$",
                    (statement, m) -> new BranchAlternative(statement)),
            ClassificationRule.of("case", "^(?:case|rank)\\s*(?:\\(|default\\b)",
                    (statement, m) -> new BranchAlternative(statement)),
            ClassificationRule.of("type-guard", "^(?:(?:type|class)\\s+is\\s*\\(|class\\s+default\\b)",
                    (statement, m) -> new BranchAlternative(statement)),
            ClassificationRule.of("end", "^end\\s*(?:(?:if|do|select|subroutine|function|program)\\b.*)?$",
                    (statement, m) -> new BlockEnd(statement)),
            ClassificationRule.of("cycle", "^cycle\\b",
                    (statement, m) -> new Jump(statement, new LoopControl(false))),
            ClassificationRule.of("exit", "^exit\\b",
                    (statement, m) -> new Jump(statement, new LoopControl(true))),
            ClassificationRule.of("return", "^(?:return\\b|contains$)",
                    (statement, m) -> new Jump(statement, new Return())),
            ClassificationRule.of("stop", "^(?:error\\s*)?stop\\b",
                    (statement, m) -> new Jump(statement, new Stop())),
            ClassificationRule.of("use", "^use\\b\\s*(?:,\\s*(?:non_)?intrinsic\\s*)?(?:::)?\\s*([0-9a-z_]+)",
                    (statement, m) -> new ModuleUse(statement, m.group(1))));

    private final List<ClassificationRule> rules;

    public StatementClassifier() {
        this(PRIMARY_RULES);
    }

    /**
     * Create a classifier over a custom primary rule table. Function
     * references and the plain fallback are always applied.
     */
    public StatementClassifier(List<ClassificationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * The primary rules in evaluation order.
     */
    public List<ClassificationRule> rules() {
        return rules;
    }

    /**
     * Classify one statement.
     *
     * @param statement  logical statement, any case
     * @param knownNames names of all routines that can be called (any case)
     * @return events in classifier order, never empty
     */
    public List<Event> classify(String statement, Set<String> knownNames) {
        String original = statement.trim();
        String normalized = StatementText.normalize(original);
        Set<String> names = knownNames.stream()
                .map(n -> n.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        List<Event> events = new ArrayList<>(functionReferences(original, normalized, names));
        events.addAll(primaryEvents(original, normalized));
        events.add(new PlainStatement(original));
        return events;
    }

    private List<Event> functionReferences(String original, String normalized, Set<String> names) {
        List<Event> calls = new ArrayList<>();
        if (names.isEmpty()) {
            return calls;
        }
        Matcher matcher = FUNCTION_REFERENCE.matcher(normalized);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (names.contains(name)
                    && !NOT_A_REFERENCE.matcher(normalized.substring(0, matcher.start())).find()) {
                calls.add(new Jump(original, new Call(name)));
            }
        }
        return calls;
    }

    private List<Event> primaryEvents(String original, String normalized) {
        String text = logicalIfAction(normalized).orElse(normalized);
        List<Event> events = new ArrayList<>();
        for (ClassificationRule rule : rules) {
            rule.apply(original, text).ifPresent(events::add);
        }
        return events;
    }

    /**
     * For {@code if (cond) action}, return the action. Block ifs and
     * statements that are not ifs yield empty.
     */
    private static Optional<String> logicalIfAction(String normalized) {
        Matcher matcher = LOGICAL_IF.matcher(normalized);
        if (!matcher.find()) {
            return Optional.empty();
        }
        int close = StatementText.closingParenthesis(normalized, matcher.end() - 1);
        if (close < 0) {
            return Optional.empty();
        }
        String action = normalized.substring(close + 1).trim();
        if (action.isEmpty() || action.equals("then")) {
            return Optional.empty();
        }
        return Optional.of(action);
    }
}
