package org.circuitry.compiler.frontend.semantics;

import org.circuitry.compiler.frontend.parser.ast.type.Type;
import org.circuitry.compiler.model.Span;

/**
 * A variable entry in the symbol table.
 *
 * @param type        The declared type.
 * @param span        The location of the declaring identifier.
 * @param declaration How the variable was introduced.
 */
public record VariableSymbol(Type type, Span span, Declaration declaration) {
}
