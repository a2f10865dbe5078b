package com.dendrol.exceptions;

/**
 * A node violates a pattern tree invariant, canonical text is malformed,
 * or the input nests deeper than the configured limit.
 */
public final class StructuralException extends PatternException {
    public StructuralException(String message) {
        super(message);
    }

    public StructuralException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Prefixes the message with the canonical text line it refers to.
     */
    public static StructuralException atLine(int line, String message) {
        return new StructuralException("line " + line + ": " + message);
    }

    public static StructuralException atLine(int line, String message, Throwable cause) {
        return new StructuralException("line " + line + ": " + message, cause);
    }
}
