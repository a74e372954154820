package org.circuitry.compiler;

import org.circuitry.compiler.diagnostics.Diagnostic;
import org.circuitry.compiler.frontend.module.ProgramContext;
import org.circuitry.compiler.frontend.parser.ast.Program;

import java.util.List;

/**
 * Output of the semantic frontend.
 *
 * @param program     The program with all imported declarations assembled into it.
 * @param context     The construction context holding the imported definitions.
 * @param diagnostics The type-checking diagnostics, in report order.
 */
public record AnalysisResult(Program program, ProgramContext context, List<Diagnostic> diagnostics) {

    public AnalysisResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }
}
