package org.circuitry.compiler.frontend.parser.ast.type;

import org.circuitry.compiler.model.Identifier;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A reference to a circuit or record type by name.
 *
 * @param name          The referenced type name.
 * @param typeArguments Generic arguments as written, possibly unresolved; empty if none.
 */
public record IdentifierType(Identifier name, List<Type> typeArguments) implements Type {

    public IdentifierType {
        typeArguments = List.copyOf(typeArguments);
    }

    public IdentifierType(Identifier name) {
        this(name, List.of());
    }

    @Override
    public boolean eqFlat(Type other) {
        return other instanceof IdentifierType named && name.name().equals(named.name().name());
    }

    @Override
    public String toString() {
        if (typeArguments.isEmpty()) {
            return name.name();
        }
        return name.name() + typeArguments.stream().map(Object::toString)
                .collect(Collectors.joining(", ", "<", ">"));
    }
}
