package org.circuitry.compiler.frontend.module;

import org.circuitry.compiler.frontend.parser.ast.ImportStatement;
import org.circuitry.compiler.frontend.parser.ast.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link DefinitionMerger}: resolves the program's own imports under the program's
 * name, then stores each circuit and function under {@code <program>_<name>}.
 */
public class ScopedDefinitionMerger implements DefinitionMerger {

    private static final Logger LOG = LoggerFactory.getLogger(ScopedDefinitionMerger.class);

    private final String separator;

    public ScopedDefinitionMerger(String separator) {
        this.separator = separator;
    }

    public ScopedDefinitionMerger() {
        this(QualifiedNames.DEFAULT_SEPARATOR);
    }

    @Override
    public void mergeAll(Program program, ImportResolver resolver, ProgramContext context) throws ImportException {
        String programName = program.name();

        for (ImportStatement nested : program.imports()) {
            resolver.enforceImport(programName, nested, context);
        }

        program.circuits().forEach((name, circuit) -> context.store(
                QualifiedNames.newScope(programName, name, separator),
                new DefinedValue.CircuitDefinition(circuit),
                programName));
        program.functions().forEach((name, function) -> context.store(
                QualifiedNames.newScope(programName, name, separator),
                DefinedValue.FunctionDefinition.unbound(function),
                programName));

        LOG.debug("Merged {} circuits and {} functions into scope '{}'",
                program.circuits().size(), program.functions().size(), programName);
    }
}
