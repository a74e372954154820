package org.circuitry.compiler.frontend.module;

import org.circuitry.compiler.frontend.parser.ast.Program;

/**
 * Installs every declaration of a program into a {@link ProgramContext}, including the
 * declarations reached through the program's own imports. Used for wildcard imports.
 */
@FunctionalInterface
public interface DefinitionMerger {

    /**
     * Merges the program into the context.
     *
     * @param program  The program, already renamed to the importing scope.
     * @param resolver The resolver to use for the program's own imports.
     * @param context  The context to install declarations into.
     * @throws ImportException If one of the program's own imports fails.
     */
    void mergeAll(Program program, ImportResolver resolver, ProgramContext context) throws ImportException;
}
