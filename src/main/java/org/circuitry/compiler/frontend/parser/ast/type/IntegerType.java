package org.circuitry.compiler.frontend.parser.ast.type;

/**
 * The fixed-width integer types.
 */
public enum IntegerType implements Type {
    U8(false, 8),
    U16(false, 16),
    U32(false, 32),
    U64(false, 64),
    U128(false, 128),
    I8(true, 8),
    I16(true, 16),
    I32(true, 32),
    I64(true, 64),
    I128(true, 128);

    private final boolean signed;
    private final int bits;

    IntegerType(boolean signed, int bits) {
        this.signed = signed;
        this.bits = bits;
    }

    @Override
    public boolean eqFlat(Type other) {
        return this == other;
    }

    @Override
    public String toString() {
        return (signed ? "i" : "u") + bits;
    }
}
