package org.circuitry.compiler.frontend.parser.ast;

import org.circuitry.compiler.model.Span;

/**
 * An {@code if} statement with an optional {@code else} branch.
 *
 * @param condition The condition.
 * @param then      The branch taken when the condition holds.
 * @param otherwise The {@code else} branch (a block or a nested conditional), or {@code null}.
 * @param span      The location of the statement.
 */
public record ConditionalStatement(
        Expression condition,
        Block then,
        Statement otherwise,
        Span span
) implements Statement {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
