package org.circuitry.compiler.frontend.parser.ast;

import org.circuitry.compiler.frontend.parser.ast.type.Type;
import org.circuitry.compiler.model.Identifier;
import org.circuitry.compiler.model.Span;

import java.util.List;

/**
 * A function declaration.
 *
 * @param identifier The function name.
 * @param inputs     The parameters, in declaration order.
 * @param output     The declared return type, or {@code null} if none was written.
 * @param block      The function body.
 * @param span       The location of the declaration.
 */
public record Function(
        Identifier identifier,
        List<FunctionInput> inputs,
        Type output,
        Block block,
        Span span
) implements AstNode {

    public Function {
        inputs = List.copyOf(inputs);
    }

    public String name() {
        return identifier.name();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
