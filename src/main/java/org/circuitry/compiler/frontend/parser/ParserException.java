package org.circuitry.compiler.frontend.parser;

import org.circuitry.compiler.model.Span;

/**
 * Thrown when a source file cannot be parsed.
 */
public class ParserException extends Exception {

    private final Span span;

    /**
     * @param message The reason the file could not be parsed.
     * @param span    Where parsing failed.
     */
    public ParserException(String message, Span span) {
        super(message);
        this.span = span;
    }

    /**
     * @param message The reason the file could not be parsed.
     * @param span    Where parsing failed.
     * @param cause   The underlying cause.
     */
    public ParserException(String message, Span span, Throwable cause) {
        super(message, cause);
        this.span = span;
    }

    public Span getSpan() {
        return span;
    }
}
