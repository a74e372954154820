package org.circuitry.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed compilation unit: its circuits and functions by name, in declaration order,
 * and the import declarations it contains.
 *
 * @param name      The program name. Imported programs are renamed via {@link #withName(String)}.
 * @param circuits  Circuit and record declarations by name.
 * @param functions Function declarations by name.
 * @param imports   Import declarations, in source order.
 */
public record Program(
        String name,
        Map<String, Circuit> circuits,
        Map<String, Function> functions,
        List<ImportStatement> imports
) implements AstNode {

    public Program {
        circuits = Collections.unmodifiableMap(new LinkedHashMap<>(circuits));
        functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        imports = List.copyOf(imports);
    }

    /**
     * Builds a program from declarations in source order. Later declarations with a name
     * already taken do not replace the first one.
     *
     * @param name      The program name.
     * @param circuits  Circuit declarations.
     * @param functions Function declarations.
     * @param imports   Import declarations.
     * @return The program.
     */
    public static Program of(String name, List<Circuit> circuits, List<Function> functions,
                             List<ImportStatement> imports) {
        Map<String, Circuit> circuitsByName = new LinkedHashMap<>();
        for (Circuit circuit : circuits) {
            circuitsByName.putIfAbsent(circuit.name(), circuit);
        }
        Map<String, Function> functionsByName = new LinkedHashMap<>();
        for (Function function : functions) {
            functionsByName.putIfAbsent(function.name(), function);
        }
        return new Program(name, circuitsByName, functionsByName, imports);
    }

    /**
     * Returns a copy of this program under a different name.
     * @param newName The new program name.
     * @return The renamed program.
     */
    public Program withName(String newName) {
        return new Program(newName, circuits, functions, imports);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
