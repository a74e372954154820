package org.circuitry.compiler.frontend.parser.ast;

import org.circuitry.compiler.model.Span;

/**
 * An expression evaluated for its effect, typically a call.
 *
 * @param expression The expression.
 * @param span       The location of the statement.
 */
public record ExpressionStatement(Expression expression, Span span) implements Statement {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
