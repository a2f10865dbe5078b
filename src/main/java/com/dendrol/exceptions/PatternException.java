package com.dendrol.exceptions;

/**
 * Base of every failure raised while turning pattern text or canonical text
 * into a {@link com.dendrol.tree.PatternTree}, or a tree back into text.
 * <p>
 * The hierarchy is closed, so callers can handle each kind of failure
 * exhaustively.
 */
public sealed abstract class PatternException extends RuntimeException permits
    GrammarException,
    LiteralException,
    StructuralException,
    EncodingException
{
    protected PatternException(String message) {
        super(message);
    }

    protected PatternException(String message, Throwable cause) {
        super(message, cause);
    }
}
