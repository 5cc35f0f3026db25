package com.raditha.fortrace.model;

/**
 * Destination of a {@link Jump}.
 */
public sealed interface JumpTarget permits Call, Goto, LoopControl, Return, Stop {
}
