package org.circuitry.compiler.frontend.parser.ast.type;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A tuple type.
 *
 * @param elements The element types, in order.
 */
public record TupleType(List<Type> elements) implements Type {

    public TupleType {
        elements = List.copyOf(elements);
    }

    @Override
    public boolean eqFlat(Type other) {
        if (!(other instanceof TupleType tuple) || elements.size() != tuple.elements.size()) {
            return false;
        }
        for (int i = 0; i < elements.size(); i++) {
            if (!elements.get(i).eqFlat(tuple.elements.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return elements.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
