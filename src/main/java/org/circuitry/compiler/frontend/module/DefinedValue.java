package org.circuitry.compiler.frontend.module;

import org.circuitry.compiler.frontend.parser.ast.Circuit;
import org.circuitry.compiler.frontend.parser.ast.Function;

import java.util.Optional;

/**
 * A declaration installed in the definition store of a {@link ProgramContext}.
 */
public sealed interface DefinedValue permits DefinedValue.CircuitDefinition, DefinedValue.FunctionDefinition {

    /**
     * @param circuit The circuit or record declaration.
     */
    record CircuitDefinition(Circuit circuit) implements DefinedValue {}

    /**
     * @param function    The function declaration.
     * @param callContext The name of the circuit instance the function is bound to, if any.
     *                    Imported functions are never bound.
     */
    record FunctionDefinition(Function function, Optional<String> callContext) implements DefinedValue {

        public static FunctionDefinition unbound(Function function) {
            return new FunctionDefinition(function, Optional.empty());
        }
    }
}
