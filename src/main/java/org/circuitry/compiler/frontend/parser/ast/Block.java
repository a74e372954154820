package org.circuitry.compiler.frontend.parser.ast;

import org.circuitry.compiler.model.Span;

import java.util.List;

/**
 * A braced sequence of statements. Each block opens its own variable scope.
 *
 * @param statements The statements, in order.
 * @param span       The location of the block.
 */
public record Block(List<Statement> statements, Span span) implements Statement {

    public Block {
        statements = List.copyOf(statements);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
