package org.circuitry.compiler.frontend.semantics;

import org.circuitry.compiler.frontend.parser.ast.InputMode;

/**
 * How a variable in the symbol table was introduced.
 */
public sealed interface Declaration permits Declaration.Input, Declaration.Let, Declaration.Const {

    /**
     * A function parameter.
     *
     * @param mode How the parameter is supplied.
     */
    record Input(InputMode mode) implements Declaration {}

    /** A {@code let} binding in a function body. */
    record Let() implements Declaration {}

    /** A {@code const} binding in a function body. */
    record Const() implements Declaration {}
}
