package org.circuitry.compiler.frontend.parser.ast;

import org.circuitry.compiler.model.Identifier;
import org.circuitry.compiler.model.Span;

/**
 * A reference to a variable or function input by name.
 *
 * @param identifier The referenced name.
 */
public record VariableExpression(Identifier identifier) implements Expression {

    @Override
    public Span span() {
        return identifier.span();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
