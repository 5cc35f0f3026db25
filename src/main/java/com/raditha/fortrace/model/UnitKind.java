package com.raditha.fortrace.model;

/**
 * Top-level shape of a source file.
 */
public enum UnitKind {
    /** File holds a main program ({@code program <name>}). */
    PROGRAM,

    /** File holds a module ({@code module <name>}). */
    MODULE,

    /** File is a plain sequence of subroutines and functions. */
    FLAT_ROUTINES
}
