package org.circuitry.compiler.diagnostics;

import org.circuitry.compiler.model.Span;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests accumulation and rendering of diagnostics.
 */
class DiagnosticsEngineTest {

    @Test
    @Tag("unit")
    void emptyEngineHasNoErrors() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(diagnostics.summary()).isEmpty();
    }

    @Test
    @Tag("unit")
    void diagnosticsKeepReportOrderAndCanBeFilteredByCode() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Span first = new Span("main.leo", 7, 2);
        Span second = new Span("main.leo", 9, 1);
        diagnostics.report(TypeCheckerErrors.functionHasNoReturn("f", first));
        diagnostics.report(TypeCheckerErrors.duplicateVariable("x", second));
        diagnostics.report(TypeCheckerErrors.functionHasNoReturn("g", first));

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::span).containsExactly(first, second, first);
        assertThat(diagnostics.withCode(TypeCheckerErrors.DUPLICATE_VARIABLE)).hasSize(1);
        assertThat(diagnostics.withCode(TypeCheckerErrors.FUNCTION_HAS_NO_RETURN)).hasSize(2);
    }

    @Test
    @Tag("unit")
    void summaryRendersLocationCodeAndMessage() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        diagnostics.report(TypeCheckerErrors.functionHasNoReturn("f", new Span("main.leo", 4, 1)));

        assertThat(diagnostics.summary())
                .isEqualTo("ERROR main.leo:4:1: [function-has-no-return] The function `f` has no return statement.");
    }
}
