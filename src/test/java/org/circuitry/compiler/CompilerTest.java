package org.circuitry.compiler;

import org.circuitry.compiler.diagnostics.Diagnostic;
import org.circuitry.compiler.diagnostics.TypeCheckerErrors;
import org.circuitry.compiler.frontend.io.SourceLoader;
import org.circuitry.compiler.frontend.module.ImportException;
import org.circuitry.compiler.frontend.module.ImportResolver;
import org.circuitry.compiler.frontend.module.ImportSettings;
import org.circuitry.compiler.frontend.module.ScopedDefinitionMerger;
import org.circuitry.compiler.frontend.parser.ast.Program;
import org.circuitry.compiler.frontend.parser.ast.type.IntegerType;
import org.circuitry.compiler.test.utils.AstFixtures.FixtureParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.circuitry.compiler.test.utils.AstFixtures.call;
import static org.circuitry.compiler.test.utils.AstFixtures.circuit;
import static org.circuitry.compiler.test.utils.AstFixtures.function;
import static org.circuitry.compiler.test.utils.AstFixtures.importOf;
import static org.circuitry.compiler.test.utils.AstFixtures.input;
import static org.circuitry.compiler.test.utils.AstFixtures.literal;
import static org.circuitry.compiler.test.utils.AstFixtures.member;
import static org.circuitry.compiler.test.utils.AstFixtures.multiple;
import static org.circuitry.compiler.test.utils.AstFixtures.named;
import static org.circuitry.compiler.test.utils.AstFixtures.program;
import static org.circuitry.compiler.test.utils.AstFixtures.returns;
import static org.circuitry.compiler.test.utils.AstFixtures.star;
import static org.circuitry.compiler.test.utils.AstFixtures.symbol;
import static org.circuitry.compiler.test.utils.AstFixtures.var;
import static org.circuitry.compiler.test.utils.AstFixtures.writeSources;

/**
 * End-to-end tests of import resolution followed by type checking.
 */
class CompilerTest {

    private static final ImportSettings SETTINGS = new ImportSettings("src", ".leo", "imports", false, "_");

    @TempDir
    Path root;

    private FixtureParser parser;
    private Compiler compiler;

    @BeforeEach
    void setUp() {
        parser = new FixtureParser();
        ImportResolver resolver = new ImportResolver(new SourceLoader(parser, ".leo"),
                new ScopedDefinitionMerger(), SETTINGS, () -> root);
        compiler = new Compiler(resolver, SETTINGS);
    }

    @Test
    @Tag("integration")
    void starImportedDeclarationsAreVisibleToMainProgram() throws Exception {
        writeSources(root, "lib");
        parser.register(program("lib",
                List.of(circuit("Point", member("x", IntegerType.U8))),
                List.of(function("helper", List.of(), returns(literal(IntegerType.U8, "1"))))));
        Program main = program("main", List.of(), List.of(
                function("run", List.of(input("p", named("Point"))), returns(call("helper", var("p"))))),
                importOf("lib", star()));

        AnalysisResult result = compiler.analyze(main);

        assertThat(result.hasErrors()).isFalse();
        assertThat(result.program().circuits()).containsOnlyKeys("main_Point");
        assertThat(result.program().functions()).containsOnlyKeys("run", "main_helper");
        assertThat(result.context().definitions()).hasSize(2);
    }

    @Test
    @Tag("integration")
    void symbolImportsAreUsableByTheirLocalNames() throws Exception {
        writeSources(root, "foo");
        parser.register(program("foo",
                List.of(circuit("Point", member("x", IntegerType.U8))),
                List.of(function("bar", List.of(input("p", named("Point"))), returns(var("p"))))));
        Program main = program("main", List.of(), List.of(
                function("run", List.of(input("q", named("Point"))), returns(call("baz", var("q"))))),
                importOf("foo", multiple(symbol("bar", "baz"), symbol("Point"))));

        AnalysisResult result = compiler.analyze(main);

        assertThat(result.context().definitions()).containsOnlyKeys("foo_baz", "foo_Point");
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    @Tag("integration")
    void aliasHidesTheOriginalSymbolName() throws Exception {
        writeSources(root, "foo");
        parser.register(program("foo", List.of(),
                List.of(function("bar", List.of(), returns(literal(IntegerType.U8, "1"))))));
        Program main = program("main", List.of(), List.of(
                function("run", List.of(), returns(call("bar")))),
                importOf("foo", symbol("bar", "baz")));

        AnalysisResult result = compiler.analyze(main);

        assertThat(result.diagnostics()).extracting(Diagnostic::code)
                .containsExactly(TypeCheckerErrors.UNKNOWN_FUNCTION);
    }

    @Test
    @Tag("integration")
    void importedFunctionSeesTheImportsOfItsOwnFile() throws Exception {
        writeSources(root, "foo", "util");
        parser.register(program("foo", List.of(),
                List.of(function("bar", List.of(), returns(call("helper")))),
                importOf("util", symbol("helper"))));
        parser.register(program("util", List.of(),
                List.of(function("helper", List.of(), returns(literal(IntegerType.U8, "1"))))));
        Program main = program("main", List.of(), List.of(
                function("run", List.of(), returns(call("bar")))),
                importOf("foo", symbol("bar")));

        AnalysisResult result = compiler.analyze(main);

        assertThat(result.context().definitions()).containsOnlyKeys("foo_bar", "util_helper");
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    @Tag("integration")
    void importsOfAnImportedFileDoNotLeakIntoMainProgram() throws Exception {
        writeSources(root, "foo", "util");
        parser.register(program("foo", List.of(),
                List.of(function("bar", List.of(), returns(literal(IntegerType.U8, "1")))),
                importOf("util", symbol("helper"))));
        parser.register(program("util", List.of(),
                List.of(function("helper", List.of(), returns(literal(IntegerType.U8, "1"))))));
        Program main = program("main", List.of(), List.of(
                function("run", List.of(), returns(call("helper")))),
                importOf("foo", symbol("bar")));

        AnalysisResult result = compiler.analyze(main);

        assertThat(result.diagnostics()).extracting(Diagnostic::message)
                .containsExactly("Unknown function `helper` called from function `run`.");
    }

    @Test
    @Tag("integration")
    void errorsInImportedDeclarationsAreReported() throws Exception {
        writeSources(root, "lib");
        parser.register(program("lib", List.of(), List.of(function("broken", List.of()))));
        Program main = program("main", List.of(), List.of(), importOf("lib", star()));

        AnalysisResult result = compiler.analyze(main);

        assertThat(result.hasErrors()).isTrue();
        assertThat(result.diagnostics()).extracting(Diagnostic::code)
                .containsExactly(TypeCheckerErrors.FUNCTION_HAS_NO_RETURN);
    }

    @Test
    @Tag("integration")
    void failedImportAbortsAnalysis() {
        Program main = program("main", List.of(), List.of(), importOf("nowhere", star()));

        assertThatThrownBy(() -> compiler.analyze(main))
                .isInstanceOf(ImportException.class)
                .extracting(e -> ((ImportException) e).getKind())
                .isEqualTo(ImportException.Kind.DIRECTORY_ERROR);
    }

    @Test
    @Tag("unit")
    void programWithoutImportsIsOnlyTypeChecked() throws Exception {
        Program main = program("main", List.of(), List.of(function("f", List.of())));

        AnalysisResult result = compiler.analyze(main);

        assertThat(result.program()).isEqualTo(main);
        assertThat(result.diagnostics()).extracting(Diagnostic::code)
                .containsExactly(TypeCheckerErrors.FUNCTION_HAS_NO_RETURN);
        assertThat(parser.parseCount()).isZero();
    }
}
