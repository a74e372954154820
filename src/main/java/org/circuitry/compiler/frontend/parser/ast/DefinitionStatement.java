package org.circuitry.compiler.frontend.parser.ast;

import org.circuitry.compiler.frontend.parser.ast.type.Type;
import org.circuitry.compiler.model.Identifier;
import org.circuitry.compiler.model.Span;

/**
 * A local variable definition, e.g. {@code let x: u8 = 1u8;}.
 *
 * @param kind     Whether the binding is {@code let} or {@code const}.
 * @param variable The variable name.
 * @param type     The declared type.
 * @param value    The initializer.
 * @param span     The location of the statement.
 */
public record DefinitionStatement(
        Kind kind,
        Identifier variable,
        Type type,
        Expression value,
        Span span
) implements Statement {

    public enum Kind {
        LET,
        CONST
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
