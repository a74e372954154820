package org.circuitry.compiler.frontend.parser.ast;

import org.circuitry.compiler.frontend.parser.ast.type.Type;
import org.circuitry.compiler.model.Span;

/**
 * A literal value, e.g. {@code 1u64} or {@code true}.
 *
 * @param type  The type of the literal.
 * @param value The literal text without its type suffix.
 * @param span  The location of the literal.
 */
public record LiteralExpression(Type type, String value, Span span) implements Expression {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
