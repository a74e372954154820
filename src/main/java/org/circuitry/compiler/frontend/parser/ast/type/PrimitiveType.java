package org.circuitry.compiler.frontend.parser.ast.type;

/**
 * The built-in non-integer types.
 */
public enum PrimitiveType implements Type {
    ADDRESS("address"),
    BOOLEAN("bool"),
    FIELD("field"),
    GROUP("group"),
    SCALAR("scalar"),
    STRING("string");

    private final String keyword;

    PrimitiveType(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public boolean eqFlat(Type other) {
        return this == other;
    }

    @Override
    public String toString() {
        return keyword;
    }
}
