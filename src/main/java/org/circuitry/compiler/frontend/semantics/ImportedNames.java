package org.circuitry.compiler.frontend.semantics;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Name resolution data produced by import resolution and consumed by the {@link TypeChecker}.
 *
 * <p>Imported declarations are stored under qualified names such as {@code foo_baz}. Source
 * code refers to them by their local name ({@code baz}), and the body of an imported
 * declaration refers to its neighbours in the scope of the program it was written in.</p>
 *
 * @param origins    Qualified name of each imported declaration to the program scope its
 *                   body is resolved in.
 * @param localNames Importing scope to the local names bound in it, each mapped to the
 *                   qualified name it stands for.
 */
public record ImportedNames(Map<String, String> origins, Map<String, Map<String, String>> localNames) {

    public ImportedNames {
        origins = Map.copyOf(origins);
        Map<String, Map<String, String>> copy = new HashMap<>();
        localNames.forEach((scope, names) -> copy.put(scope, Map.copyOf(names)));
        localNames = Map.copyOf(copy);
    }

    /**
     * Resolution data for a program without imports.
     */
    public static ImportedNames none() {
        return new ImportedNames(Map.of(), Map.of());
    }

    /**
     * Gets the scope the body of a declaration is resolved in.
     * @param declarationName The name the declaration is registered under.
     * @param defaultScope    The scope of declarations that were not imported.
     * @return The declaring program's scope.
     */
    public String scopeOf(String declarationName, String defaultScope) {
        return origins.getOrDefault(declarationName, defaultScope);
    }

    /**
     * Looks up a local name bound by an import in the given scope.
     * @param scope     The importing scope.
     * @param localName The alias or symbol name used in source.
     * @return The qualified name the local name stands for, or empty if no import binds it.
     */
    public Optional<String> resolve(String scope, String localName) {
        return Optional.ofNullable(localNames.getOrDefault(scope, Map.of()).get(localName));
    }
}
