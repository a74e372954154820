package org.circuitry.compiler.frontend.semantics;

import org.circuitry.compiler.frontend.parser.ast.Circuit;
import org.circuitry.compiler.frontend.parser.ast.Function;
import org.circuitry.compiler.model.Identifier;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Symbol table used during type checking.
 *
 * <p>Circuits and functions are program-global and registered once per program. Variables
 * live in a scope hierarchy that is rebuilt for every function: the function's inputs sit in
 * the root scope and every nested block opens a child scope. Lookups search from the current
 * scope outwards; a definition only conflicts with names in the current scope.</p>
 */
public class SymbolTable {

    /**
     * A single variable scope.
     */
    public static class Scope {
        private final Scope parent;
        private final Map<String, VariableSymbol> variables = new HashMap<>();

        Scope(Scope parent) {
            this.parent = parent;
        }
    }

    private final Map<String, Circuit> circuits = new HashMap<>();
    private final Map<String, Function> functions = new HashMap<>();

    private Scope rootScope;
    private Scope currentScope;

    /**
     * Constructs a new, empty symbol table.
     */
    public SymbolTable() {
        this.rootScope = new Scope(null);
        this.currentScope = this.rootScope;
    }

    // === Program-global declarations ===

    /**
     * Registers a circuit under the given name. An existing registration is kept.
     * @param name    The name to register under.
     * @param circuit The circuit declaration.
     */
    public void insertCircuit(String name, Circuit circuit) {
        circuits.putIfAbsent(name, circuit);
    }

    /**
     * Registers a function under the given name. An existing registration is kept.
     * @param name     The name to register under.
     * @param function The function declaration.
     */
    public void insertFunction(String name, Function function) {
        functions.putIfAbsent(name, function);
    }

    public Optional<Circuit> lookupCircuit(String name) {
        return Optional.ofNullable(circuits.get(name));
    }

    public Optional<Function> lookupFunction(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    // === Variable scopes ===

    /**
     * Discards all variables and scopes and starts over with an empty root scope.
     */
    public void clearVariables() {
        this.rootScope = new Scope(null);
        this.currentScope = this.rootScope;
    }

    /**
     * Enters a new child scope of the current scope.
     * @return The new scope.
     */
    public Scope enterScope() {
        Scope newScope = new Scope(currentScope);
        currentScope = newScope;
        return newScope;
    }

    /**
     * Leaves the current scope and moves to the parent scope.
     */
    public void leaveScope() {
        if (currentScope.parent != null) {
            currentScope = currentScope.parent;
        }
    }

    public Scope getCurrentScope() {
        return currentScope;
    }

    public Scope getRootScope() {
        return rootScope;
    }

    /**
     * Defines a variable in the current scope. If the name is already defined in the current
     * scope the existing entry is kept.
     *
     * @param name   The variable name.
     * @param symbol The variable entry.
     * @return True if the variable was inserted, false if the name was already taken.
     */
    public boolean insertVariable(Identifier name, VariableSymbol symbol) {
        return currentScope.variables.putIfAbsent(name.name(), symbol) == null;
    }

    /**
     * Resolves a variable by name, searching from the current scope upwards to the root.
     * @param name The variable name.
     * @return The variable entry, or empty if no enclosing scope defines it.
     */
    public Optional<VariableSymbol> lookupVariable(String name) {
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            VariableSymbol symbol = scope.variables.get(name);
            if (symbol != null) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }
}
