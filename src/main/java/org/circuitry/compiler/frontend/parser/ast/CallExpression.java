package org.circuitry.compiler.frontend.parser.ast;

import org.circuitry.compiler.model.Identifier;
import org.circuitry.compiler.model.Span;

import java.util.List;

/**
 * A call to a function by name.
 *
 * @param function  The called function name.
 * @param arguments The arguments, in order.
 * @param span      The location of the call.
 */
public record CallExpression(Identifier function, List<Expression> arguments, Span span) implements Expression {

    public CallExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
