package org.circuitry.compiler.frontend.parser.ast;

import org.circuitry.compiler.frontend.parser.ast.type.Type;
import org.circuitry.compiler.model.Identifier;
import org.circuitry.compiler.model.Span;

/**
 * A single parameter of a function.
 *
 * @param identifier The parameter name.
 * @param mode       How the value is supplied.
 * @param type       The declared type.
 * @param span       The location of the parameter declaration.
 */
public record FunctionInput(Identifier identifier, InputMode mode, Type type, Span span) {
}
