package com.raditha.fortrace.tracing;

/**
 * Thrown when the traced source violates the structure the tracer relies on.
 * The trace that raised it yields no further statements.
 */
public class TraceException extends RuntimeException {

    private final TraceError error;

    public TraceException(TraceError error, String message) {
        super(message);
        this.error = error;
    }

    public TraceError getError() {
        return error;
    }
}
