package org.circuitry.compiler.test.utils;

import org.circuitry.compiler.frontend.parser.ParserException;
import org.circuitry.compiler.frontend.parser.ProgramParser;
import org.circuitry.compiler.frontend.parser.ast.Block;
import org.circuitry.compiler.frontend.parser.ast.CallExpression;
import org.circuitry.compiler.frontend.parser.ast.Circuit;
import org.circuitry.compiler.frontend.parser.ast.CircuitMember;
import org.circuitry.compiler.frontend.parser.ast.Expression;
import org.circuitry.compiler.frontend.parser.ast.Function;
import org.circuitry.compiler.frontend.parser.ast.FunctionInput;
import org.circuitry.compiler.frontend.parser.ast.ImportStatement;
import org.circuitry.compiler.frontend.parser.ast.ImportSymbol;
import org.circuitry.compiler.frontend.parser.ast.InputMode;
import org.circuitry.compiler.frontend.parser.ast.LiteralExpression;
import org.circuitry.compiler.frontend.parser.ast.PackageAccess;
import org.circuitry.compiler.frontend.parser.ast.PackageRef;
import org.circuitry.compiler.frontend.parser.ast.Program;
import org.circuitry.compiler.frontend.parser.ast.ReturnStatement;
import org.circuitry.compiler.frontend.parser.ast.Statement;
import org.circuitry.compiler.frontend.parser.ast.VariableExpression;
import org.circuitry.compiler.frontend.parser.ast.type.IdentifierType;
import org.circuitry.compiler.frontend.parser.ast.type.Type;
import org.circuitry.compiler.model.Identifier;
import org.circuitry.compiler.model.Span;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for AST nodes and a fixture-backed parser, so tests can describe programs
 * without a concrete source syntax.
 */
public final class AstFixtures {

    private AstFixtures() {
        // Private constructor to prevent instantiation
    }

    public static Span span(int line) {
        return new Span("test.leo", line, 1);
    }

    public static Identifier id(String name) {
        return new Identifier(name, span(1));
    }

    public static IdentifierType named(String name) {
        return new IdentifierType(id(name));
    }

    public static FunctionInput input(String name, Type type) {
        return new FunctionInput(id(name), InputMode.PRIVATE, type, span(1));
    }

    public static FunctionInput input(String name, InputMode mode, Type type) {
        return new FunctionInput(id(name), mode, type, span(1));
    }

    public static Block block(Statement... statements) {
        return new Block(List.of(statements), span(1));
    }

    public static ReturnStatement returns(Expression expression) {
        return new ReturnStatement(expression, span(2));
    }

    public static VariableExpression var(String name) {
        return new VariableExpression(id(name));
    }

    public static LiteralExpression literal(Type type, String value) {
        return new LiteralExpression(type, value, span(1));
    }

    public static CallExpression call(String function, Expression... arguments) {
        return new CallExpression(id(function), List.of(arguments), span(1));
    }

    public static Function function(String name, List<FunctionInput> inputs, Statement... body) {
        return new Function(id(name), inputs, null, block(body), span(1));
    }

    public static CircuitMember member(String name, Type type) {
        return new CircuitMember(id(name), type);
    }

    public static Circuit circuit(String name, CircuitMember... members) {
        return new Circuit(id(name), List.of(members), false, span(1));
    }

    public static Circuit record(String name, CircuitMember... members) {
        return new Circuit(id(name), List.of(members), true, span(1));
    }

    public static Program program(String name, List<Circuit> circuits, List<Function> functions,
                                  ImportStatement... imports) {
        return Program.of(name, circuits, functions, List.of(imports));
    }

    // --- Imports ---

    public static PackageAccess star() {
        return new PackageAccess.Star(span(1));
    }

    public static PackageAccess symbol(String name) {
        return new PackageAccess.SymbolAccess(new ImportSymbol(id(name), null, span(1)));
    }

    public static PackageAccess symbol(String name, String alias) {
        return new PackageAccess.SymbolAccess(new ImportSymbol(id(name), id(alias), span(1)));
    }

    public static PackageAccess subPackage(String name, PackageAccess access) {
        return new PackageAccess.SubPackage(packageRef(name, access));
    }

    public static PackageAccess multiple(PackageAccess... accesses) {
        return new PackageAccess.Multiple(Arrays.asList(accesses));
    }

    public static PackageRef packageRef(String name, PackageAccess access) {
        return new PackageRef(id(name), access, span(1));
    }

    public static ImportStatement importOf(String packageName, PackageAccess access) {
        return new ImportStatement(packageRef(packageName, access), span(1));
    }

    /**
     * Writes an empty source file for each package name under {@code root/src}.
     */
    public static void writeSources(Path root, String... packageNames) throws IOException {
        Path src = Files.createDirectories(root.resolve("src"));
        for (String packageName : packageNames) {
            Files.writeString(src.resolve(packageName + ".leo"), "// " + packageName + "\n");
        }
    }

    /**
     * A parser that ignores file contents and returns the program registered for the file's
     * program name.
     */
    public static final class FixtureParser implements ProgramParser {

        private final Map<String, Program> programs = new HashMap<>();
        private int parseCount;

        public FixtureParser register(Program program) {
            programs.put(program.name(), program);
            return this;
        }

        public int parseCount() {
            return parseCount;
        }

        @Override
        public Program parse(Path path, String contents, String programName) throws ParserException {
            parseCount++;
            Program program = programs.get(programName);
            if (program == null) {
                throw new ParserException("No fixture registered for " + programName, new Span(path.toString(), 1, 1));
            }
            return program.withName(programName);
        }
    }
}
