package org.circuitry.compiler.frontend.parser.ast;

import org.circuitry.compiler.frontend.parser.ast.type.Type;
import org.circuitry.compiler.model.Identifier;

/**
 * A named, typed member variable of a circuit or record.
 *
 * @param identifier The member name.
 * @param type       The declared member type.
 */
public record CircuitMember(Identifier identifier, Type type) {

    public String name() {
        return identifier.name();
    }
}
