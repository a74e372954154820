package org.circuitry.compiler.frontend.parser.ast;

import org.circuitry.compiler.model.Identifier;
import org.circuitry.compiler.model.Span;

import java.util.List;

/**
 * An aggregate type declaration. Records are circuits that describe owned state and
 * must carry an {@code owner} and a {@code balance} member.
 *
 * @param identifier The type name.
 * @param members    The members, in declaration order.
 * @param isRecord   True if declared as a record.
 * @param span       The location of the declaration.
 */
public record Circuit(
        Identifier identifier,
        List<CircuitMember> members,
        boolean isRecord,
        Span span
) implements AstNode {

    public Circuit {
        members = List.copyOf(members);
    }

    public String name() {
        return identifier.name();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
