package org.circuitry.compiler.frontend.parser.ast;

import org.circuitry.compiler.model.Span;

/**
 * @param expression The returned value.
 * @param span       The location of the statement.
 */
public record ReturnStatement(Expression expression, Span span) implements Statement {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
