package org.circuitry.compiler.model;

/**
 * A name as written in source, together with where it was written.
 *
 * @param name The identifier text.
 * @param span The location of the identifier.
 */
public record Identifier(String name, Span span) {

    /**
     * Creates an identifier without source location, for synthesized nodes and tests.
     * @param name The identifier text.
     * @return The identifier.
     */
    public static Identifier of(String name) {
        return new Identifier(name, Span.DUMMY);
    }

    @Override
    public String toString() {
        return name;
    }
}
