package org.circuitry.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one compilation. Reporting never aborts the caller,
 * so a single pass can surface every violated rule.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Records a diagnostic.
     * @param diagnostic The diagnostic to record.
     */
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /**
     * Checks whether at least one error has been reported.
     * @return True if any diagnostic has severity {@link Diagnostic.Severity#ERROR}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    /**
     * Gets all diagnostics in the order they were reported.
     * @return An unmodifiable view of the diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Gets the diagnostics that were reported with the given rule code.
     * @param code The rule code.
     * @return The matching diagnostics, in report order.
     */
    public List<Diagnostic> withCode(String code) {
        return diagnostics.stream()
                .filter(d -> code.equals(d.code()))
                .collect(Collectors.toList());
    }

    /**
     * Renders all diagnostics, one per line.
     * @return The summary text, empty if nothing was reported.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
