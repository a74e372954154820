package org.circuitry.compiler.frontend.module;

import org.circuitry.compiler.frontend.parser.ast.Circuit;
import org.circuitry.compiler.frontend.parser.ast.Function;
import org.circuitry.compiler.frontend.parser.ast.Program;
import org.circuitry.compiler.frontend.parser.ast.type.IntegerType;
import org.circuitry.compiler.frontend.semantics.ImportedNames;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.circuitry.compiler.test.utils.AstFixtures.circuit;
import static org.circuitry.compiler.test.utils.AstFixtures.function;
import static org.circuitry.compiler.test.utils.AstFixtures.importOf;
import static org.circuitry.compiler.test.utils.AstFixtures.literal;
import static org.circuitry.compiler.test.utils.AstFixtures.member;
import static org.circuitry.compiler.test.utils.AstFixtures.program;
import static org.circuitry.compiler.test.utils.AstFixtures.returns;
import static org.circuitry.compiler.test.utils.AstFixtures.star;

class ProgramContextTest {

    private static Function fn(String name) {
        return function(name, List.of(), returns(literal(IntegerType.U8, "1")));
    }

    @Test
    @Tag("unit")
    void storeReplacesPreviousValue() {
        ProgramContext context = new ProgramContext();
        Function first = fn("a");
        Function second = fn("b");

        context.store("lib_a", DefinedValue.FunctionDefinition.unbound(first), "lib");
        context.store("lib_a", DefinedValue.FunctionDefinition.unbound(second), "lib");

        assertThat(context.definitions()).hasSize(1);
        assertThat(context.get("lib_a")).contains(DefinedValue.FunctionDefinition.unbound(second), "lib");
        assertThat(context.get("lib_b")).isEmpty();
    }

    @Test
    @Tag("unit")
    void definitionsViewIsReadOnly() {
        ProgramContext context = new ProgramContext();

        assertThatThrownBy(() -> context.definitions().put("x", DefinedValue.FunctionDefinition.unbound(fn("x"))))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @Tag("unit")
    void assembleAppendsStoredDeclarationsUnderQualifiedNames() {
        ProgramContext context = new ProgramContext();
        Circuit point = circuit("Point", member("x", IntegerType.U8));
        Function helper = fn("helper");
        context.store("lib_Point", new DefinedValue.CircuitDefinition(point), "lib");
        context.store("lib_helper", DefinedValue.FunctionDefinition.unbound(helper), "lib");
        Program main = program("main", List.of(), List.of(fn("main")), importOf("lib", star()));

        Program assembled = context.assemble(main);

        assertThat(assembled.name()).isEqualTo("main");
        assertThat(assembled.circuits()).containsOnlyKeys("lib_Point");
        assertThat(assembled.functions().keySet()).containsExactly("main", "lib_helper");
        assertThat(assembled.functions().get("lib_helper")).isSameAs(helper);
        assertThat(assembled.imports()).isEqualTo(main.imports());
    }

    @Test
    @Tag("unit")
    void ownDeclarationWinsOverStoredOneOfSameName() {
        ProgramContext context = new ProgramContext();
        Function own = fn("main_f");
        context.store("main_f", DefinedValue.FunctionDefinition.unbound(fn("other")), "main");

        Program assembled = context.assemble(program("main", List.of(), List.of(own)));

        assertThat(assembled.functions().get("main_f")).isSameAs(own);
    }

    @Test
    @Tag("unit")
    void importedNamesCarryOriginsAndLocalNamesPerScope() {
        ProgramContext context = new ProgramContext();
        context.store("foo_baz", DefinedValue.FunctionDefinition.unbound(fn("bar")), "foo");
        context.bindLocalName("main", "baz", "foo_baz");

        ImportedNames names = context.importedNames();

        assertThat(names.scopeOf("foo_baz", "main")).isEqualTo("foo");
        assertThat(names.scopeOf("run", "main")).isEqualTo("main");
        assertThat(names.resolve("main", "baz")).contains("foo_baz");
        assertThat(names.resolve("foo", "baz")).isEmpty();
        assertThat(names.resolve("main", "bar")).isEmpty();
    }

    @Test
    @Tag("unit")
    void importedNamesAreASnapshot() {
        ProgramContext context = new ProgramContext();
        ImportedNames before = context.importedNames();

        context.bindLocalName("main", "baz", "foo_baz");

        assertThat(before.resolve("main", "baz")).isEmpty();
        assertThat(context.importedNames().resolve("main", "baz")).contains("foo_baz");
    }
}
