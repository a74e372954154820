package org.circuitry.compiler.frontend.parser.ast;

import org.circuitry.compiler.model.Identifier;
import org.circuitry.compiler.model.Span;

/**
 * A single imported name with an optional local alias.
 *
 * @param symbol The name of the circuit or function in the imported file.
 * @param alias  The local name to install it under, or {@code null} to keep {@code symbol}.
 * @param span   The location of the symbol in the import declaration.
 */
public record ImportSymbol(Identifier symbol, Identifier alias, Span span) {

    /**
     * Gets the name the symbol is known by in the importing program.
     * @return The alias if present, otherwise the symbol name.
     */
    public String localName() {
        return alias != null ? alias.name() : symbol.name();
    }
}
