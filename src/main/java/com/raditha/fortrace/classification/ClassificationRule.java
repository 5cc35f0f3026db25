package com.raditha.fortrace.classification;

import com.raditha.fortrace.model.Event;

import java.util.Optional;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One entry of the classifier's rule table: a pattern tried against the
 * normalized statement and the event built when it matches.
 *
 * @param name    rule name, for logging and tests
 * @param pattern anchored pattern over the lowercase statement
 * @param factory builds the event from the original statement and the match
 */
public record ClassificationRule(
        String name,
        Pattern pattern,
        BiFunction<String, Matcher, Event> factory) {

    public static ClassificationRule of(String name, String regex, BiFunction<String, Matcher, Event> factory) {
        return new ClassificationRule(name, Pattern.compile(regex), factory);
    }

    /**
     * Apply the rule.
     *
     * @param statement  original statement, kept inside the event
     * @param normalized lowercase statement the pattern is matched against
     * @return the event, or empty when the rule does not match
     */
    public Optional<Event> apply(String statement, String normalized) {
        Matcher matcher = pattern.matcher(normalized);
        if (matcher.find()) {
            return Optional.of(factory.apply(statement, matcher));
        }
        return Optional.empty();
    }
}
