package org.circuitry.compiler.frontend.module;

import org.circuitry.compiler.frontend.parser.ast.Circuit;
import org.circuitry.compiler.frontend.parser.ast.Function;
import org.circuitry.compiler.frontend.parser.ast.Program;
import org.circuitry.compiler.frontend.semantics.ImportedNames;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Construction state of one program: the definition store that import resolution writes
 * imported circuits and functions into, keyed by qualified name, and the local names that
 * symbol imports bind in their importing scope.
 *
 * <p>Only the {@link ImportResolver} and its {@link DefinitionMerger} write to the store,
 * from a single thread.</p>
 */
public class ProgramContext {

    private final Map<String, DefinedValue> definitions = new LinkedHashMap<>();
    private final Map<String, String> origins = new HashMap<>();
    private final Map<String, Map<String, String>> localNames = new HashMap<>();

    /**
     * Installs a value under a qualified name, replacing any previous value.
     * @param qualifiedName The store key.
     * @param value         The declaration to store.
     * @param origin        The name of the program the declaration is resolved in.
     */
    public void store(String qualifiedName, DefinedValue value, String origin) {
        definitions.put(qualifiedName, value);
        origins.put(qualifiedName, origin);
    }

    /**
     * Makes a stored declaration reachable by a local name inside an importing scope.
     * @param scope         The importing program's name.
     * @param localName     The alias, or the symbol name if there is no alias.
     * @param qualifiedName The store key the local name stands for.
     */
    public void bindLocalName(String scope, String localName, String qualifiedName) {
        localNames.computeIfAbsent(scope, s -> new HashMap<>()).put(localName, qualifiedName);
    }

    /**
     * Gets the resolution data that lets the type checker find imported declarations by
     * their local names.
     * @return A snapshot of origins and local names.
     */
    public ImportedNames importedNames() {
        return new ImportedNames(origins, localNames);
    }

    public Optional<DefinedValue> get(String qualifiedName) {
        return Optional.ofNullable(definitions.get(qualifiedName));
    }

    public boolean contains(String qualifiedName) {
        return definitions.containsKey(qualifiedName);
    }

    /**
     * Gets the whole store in installation order.
     * @return An unmodifiable view of the store.
     */
    public Map<String, DefinedValue> definitions() {
        return Collections.unmodifiableMap(definitions);
    }

    /**
     * Builds the program that later passes analyze: the declarations of {@code main} followed
     * by every stored declaration under its qualified name. A stored name that collides with a
     * declaration of {@code main} does not replace it.
     *
     * @param main The importing program.
     * @return The assembled program, with the imports of {@code main}.
     */
    public Program assemble(Program main) {
        Map<String, Circuit> circuits = new LinkedHashMap<>(main.circuits());
        Map<String, Function> functions = new LinkedHashMap<>(main.functions());
        definitions.forEach((name, value) -> {
            if (value instanceof DefinedValue.CircuitDefinition circuit) {
                circuits.putIfAbsent(name, circuit.circuit());
            } else if (value instanceof DefinedValue.FunctionDefinition function) {
                functions.putIfAbsent(name, function.function());
            }
        });
        return new Program(main.name(), circuits, functions, main.imports());
    }
}
