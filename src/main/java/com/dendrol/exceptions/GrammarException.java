package com.dendrol.exceptions;

/**
 * The pattern text does not conform to the STIX pattern grammar.
 * Only the first error is reported; there is no recovery.
 */
public final class GrammarException extends PatternException {
    private final int line;
    private final int column;

    public GrammarException(int line, int column, String message) {
        super(line + ":" + column + ": " + message);
        this.line = line;
        this.column = column;
    }

    public GrammarException(int line, int column, String message, Throwable cause) {
        super(line + ":" + column + ": " + message, cause);
        this.line = line;
        this.column = column;
    }

    /**
     * @return 1-based line of the offending token
     */
    public int line() {
        return line;
    }

    /**
     * @return 0-based column of the offending token
     */
    public int column() {
        return column;
    }
}
