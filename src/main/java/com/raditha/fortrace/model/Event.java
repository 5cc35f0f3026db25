package com.raditha.fortrace.model;

/**
 * Control-flow meaning of one logical statement.
 * <p>
 * A statement may classify into several events: one call event per embedded
 * function call, at most one primary event and always a trailing
 * {@link PlainStatement}. Every event keeps the original statement text.
 */
public sealed interface Event permits PlainStatement, ModuleUse, BlockStart, BlockEnd, BranchAlternative, Jump {

    /**
     * The statement that produced this event, in its original case.
     */
    String statement();

    /**
     * Plain events carry no control-flow meaning and are skipped by the tracer.
     */
    default boolean isStructural() {
        return !(this instanceof PlainStatement);
    }
}
