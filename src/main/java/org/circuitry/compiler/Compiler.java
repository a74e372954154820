package org.circuitry.compiler;

import org.circuitry.compiler.diagnostics.DiagnosticsEngine;
import org.circuitry.compiler.frontend.module.ImportException;
import org.circuitry.compiler.frontend.module.ImportResolver;
import org.circuitry.compiler.frontend.module.ImportSettings;
import org.circuitry.compiler.frontend.module.ProgramContext;
import org.circuitry.compiler.frontend.parser.ProgramParser;
import org.circuitry.compiler.frontend.parser.ast.ImportStatement;
import org.circuitry.compiler.frontend.parser.ast.Program;
import org.circuitry.compiler.frontend.semantics.SymbolTable;
import org.circuitry.compiler.frontend.semantics.TypeChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the semantic frontend on a parsed program.
 *
 * <ol>
 *   <li>Import resolution: every import of the main program is resolved with the main program's
 *       name as importing scope. The first failure aborts the analysis.</li>
 *   <li>Assembly: the main program's declarations are combined with every imported definition.</li>
 *   <li>Type checking: the assembled program is checked and all diagnostics are collected.</li>
 * </ol>
 */
public class Compiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final ImportResolver importResolver;
    private final ImportSettings settings;

    /**
     * Creates a compiler that resolves imports against the current working directory.
     * @param parser   The parser for imported files.
     * @param settings The filesystem conventions.
     */
    public Compiler(ProgramParser parser, ImportSettings settings) {
        this(new ImportResolver(parser, settings), settings);
    }

    /**
     * Creates a compiler with the default settings from {@code reference.conf}.
     * @param parser The parser for imported files.
     */
    public Compiler(ProgramParser parser) {
        this(parser, ImportSettings.defaults());
    }

    public Compiler(ImportResolver importResolver, ImportSettings settings) {
        this.importResolver = importResolver;
        this.settings = settings;
    }

    /**
     * Resolves the imports of {@code main} and type-checks the result.
     *
     * @param main The parsed main program.
     * @return The assembled program and the type-checking diagnostics.
     * @throws ImportException If an import cannot be resolved.
     */
    public AnalysisResult analyze(Program main) throws ImportException {
        ProgramContext context = new ProgramContext();
        for (ImportStatement imports : main.imports()) {
            importResolver.enforceImport(main.name(), imports, context);
        }
        Program assembled = context.assemble(main);

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        new TypeChecker(new SymbolTable(), diagnostics, settings.scopeSeparator(), context.importedNames())
                .check(assembled);

        LOG.debug("Analyzed program '{}': {} imported definitions, {} diagnostics",
                main.name(), context.definitions().size(), diagnostics.getDiagnostics().size());
        return new AnalysisResult(assembled, context, diagnostics.getDiagnostics());
    }
}
