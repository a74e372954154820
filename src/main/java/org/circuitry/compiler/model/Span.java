package org.circuitry.compiler.model;

/**
 * A location in a source file, attached to AST nodes and diagnostics.
 *
 * @param fileName The file the node originated from.
 * @param line     The 1-based line number, or 0 if unknown.
 * @param column   The 1-based column number, or 0 if unknown.
 */
public record Span(String fileName, int line, int column) {

    /** Placeholder for synthetic nodes that have no source location. */
    public static final Span DUMMY = new Span("", 0, 0);

    @Override
    public String toString() {
        return fileName + ":" + line + ":" + column;
    }
}
