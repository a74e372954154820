package org.circuitry.compiler.frontend.parser.ast.type;

/**
 * A fixed-length array type.
 *
 * @param elementType The element type.
 * @param length      The number of elements.
 */
public record ArrayType(Type elementType, int length) implements Type {

    @Override
    public boolean eqFlat(Type other) {
        return other instanceof ArrayType array
                && length == array.length
                && elementType.eqFlat(array.elementType);
    }

    @Override
    public String toString() {
        return "[" + elementType + "; " + length + "]";
    }
}
