package com.dendrol.exceptions;

/**
 * A literal has no canonical text form.
 */
public final class EncodingException extends PatternException {
    public EncodingException(String message) {
        super(message);
    }
}
