package com.dendrol.exceptions;

/**
 * A token could not be decoded to a typed literal.
 */
public final class LiteralException extends PatternException {
    public enum Reason {
        BAD_ESCAPE,
        UNESCAPED_QUOTE,
        NON_UTC_TIMESTAMP,
        MALFORMED_TIMESTAMP,
        ODD_LENGTH_HEX,
        MALFORMED_HEX,
        MALFORMED_BINARY,
        MALFORMED_NUMBER,
        MALFORMED_BOOLEAN,
        MALFORMED_STRING,
        MALFORMED_INDEX,
        UNSUPPORTED_LITERAL,
    }

    private final Reason reason;
    private final String text;

    public LiteralException(Reason reason, String text) {
        super(reason + ": " + text);
        this.reason = reason;
        this.text = text;
    }

    public LiteralException(Reason reason, String text, Throwable cause) {
        super(reason + ": " + text, cause);
        this.reason = reason;
        this.text = text;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * @return the offending lexeme or scalar, as written
     */
    public String text() {
        return text;
    }
}
