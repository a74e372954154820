package org.circuitry.compiler.frontend.parser.ast;

/**
 * How a function input is supplied to the circuit.
 */
public enum InputMode {
    /** Visible to the verifier. */
    PUBLIC,
    /** Known only to the prover. */
    PRIVATE,
    /** Fixed at compile time. */
    CONSTANT
}
