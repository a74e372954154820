package org.circuitry.compiler.frontend.parser.ast.type;

/**
 * A type as declared in source.
 */
public interface Type {

    /**
     * Compares the type constructors of this type and {@code other}, ignoring any generic
     * arguments attached to named types. Array lengths and tuple arities are part of the
     * constructor and must match.
     *
     * @param other The type to compare against.
     * @return True if both types are built from the same constructors.
     */
    boolean eqFlat(Type other);
}
