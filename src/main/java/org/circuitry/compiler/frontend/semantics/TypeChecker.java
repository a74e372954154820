package org.circuitry.compiler.frontend.semantics;

import org.circuitry.compiler.diagnostics.DiagnosticsEngine;
import org.circuitry.compiler.diagnostics.TypeCheckerErrors;
import org.circuitry.compiler.frontend.module.QualifiedNames;
import org.circuitry.compiler.frontend.parser.ast.AstVisitor;
import org.circuitry.compiler.frontend.parser.ast.Block;
import org.circuitry.compiler.frontend.parser.ast.CallExpression;
import org.circuitry.compiler.frontend.parser.ast.Circuit;
import org.circuitry.compiler.frontend.parser.ast.CircuitMember;
import org.circuitry.compiler.frontend.parser.ast.ConditionalStatement;
import org.circuitry.compiler.frontend.parser.ast.DefinitionStatement;
import org.circuitry.compiler.frontend.parser.ast.Expression;
import org.circuitry.compiler.frontend.parser.ast.ExpressionStatement;
import org.circuitry.compiler.frontend.parser.ast.Function;
import org.circuitry.compiler.frontend.parser.ast.FunctionInput;
import org.circuitry.compiler.frontend.parser.ast.LiteralExpression;
import org.circuitry.compiler.frontend.parser.ast.Program;
import org.circuitry.compiler.frontend.parser.ast.ReturnStatement;
import org.circuitry.compiler.frontend.parser.ast.Statement;
import org.circuitry.compiler.frontend.parser.ast.VariableExpression;
import org.circuitry.compiler.frontend.parser.ast.type.ArrayType;
import org.circuitry.compiler.frontend.parser.ast.type.IdentifierType;
import org.circuitry.compiler.frontend.parser.ast.type.IntegerType;
import org.circuitry.compiler.frontend.parser.ast.type.PrimitiveType;
import org.circuitry.compiler.frontend.parser.ast.type.TupleType;
import org.circuitry.compiler.frontend.parser.ast.type.Type;
import org.circuitry.compiler.model.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Type-checks an assembled program: function inputs and bodies, and circuit and record
 * declarations. Every violated rule is reported to the {@link DiagnosticsEngine} and
 * checking continues, so one run surfaces all errors of the program.
 *
 * <p>Checking happens in two passes. The first registers every circuit and function of the
 * program in the {@link SymbolTable}; the second visits circuits and then functions in
 * declaration order.</p>
 *
 * <p>A type or function name resolves if it is registered as written, under the qualified
 * name {@code <scope>_<name>}, or as a local name bound by an import in the scope. The scope
 * is the checked program for its own declarations and the declaring program for imported
 * ones.</p>
 */
public class TypeChecker implements AstVisitor<Void> {

    private static final Logger LOG = LoggerFactory.getLogger(TypeChecker.class);

    static final String OWNER = "owner";
    static final String BALANCE = "balance";

    private final SymbolTable symbolTable;
    private final DiagnosticsEngine diagnostics;
    private final String scopeSeparator;
    private final ImportedNames importedNames;

    private String programName = "";
    private String scope = "";
    private boolean hasReturn;
    private String parent;

    /**
     * @param symbolTable    The symbol table to register declarations in.
     * @param diagnostics    The engine that collects reported errors.
     * @param scopeSeparator The separator used for program-qualified names of imported declarations.
     * @param importedNames  The origins and local names of imported declarations.
     */
    public TypeChecker(SymbolTable symbolTable, DiagnosticsEngine diagnostics, String scopeSeparator,
                       ImportedNames importedNames) {
        this.symbolTable = symbolTable;
        this.diagnostics = diagnostics;
        this.scopeSeparator = scopeSeparator;
        this.importedNames = importedNames;
    }

    public TypeChecker(SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        this(symbolTable, diagnostics, QualifiedNames.DEFAULT_SEPARATOR, ImportedNames.none());
    }

    /**
     * Checks the given program.
     * @param program The program, with imports already resolved into it.
     */
    public void check(Program program) {
        program.accept(this);
    }

    @Override
    public Void visit(Program node) {
        programName = node.name();
        LOG.debug("Type-checking program '{}' ({} circuits, {} functions)",
                programName, node.circuits().size(), node.functions().size());

        node.circuits().forEach(symbolTable::insertCircuit);
        node.functions().forEach(symbolTable::insertFunction);

        for (Map.Entry<String, Circuit> circuit : node.circuits().entrySet()) {
            scope = importedNames.scopeOf(circuit.getKey(), programName);
            circuit.getValue().accept(this);
        }
        for (Map.Entry<String, Function> function : node.functions().entrySet()) {
            scope = importedNames.scopeOf(function.getKey(), programName);
            function.getValue().accept(this);
        }
        return null;
    }

    @Override
    public Void visit(Function node) {
        hasReturn = false;
        symbolTable.clearVariables();
        parent = node.name();

        Set<String> reportedDuplicates = new HashSet<>();
        for (FunctionInput input : node.inputs()) {
            checkIdentType(input.type(), input.span());
            boolean inserted = symbolTable.insertVariable(input.identifier(), new VariableSymbol(
                    input.type(),
                    input.identifier().span(),
                    new Declaration.Input(input.mode())));
            // One report per repeated name, however often it repeats.
            if (!inserted && reportedDuplicates.add(input.identifier().name())) {
                diagnostics.report(TypeCheckerErrors.duplicateVariable(
                        input.identifier().name(), input.identifier().span()));
            }
        }
        checkIdentType(node.output(), node.span());

        // The body shares the scope of the inputs; only nested blocks open new scopes.
        for (Statement statement : node.block().statements()) {
            statement.accept(this);
        }

        if (!hasReturn) {
            diagnostics.report(TypeCheckerErrors.functionHasNoReturn(node.name(), node.span()));
        }
        return null;
    }

    @Override
    public Void visit(Circuit node) {
        Set<String> used = new HashSet<>();
        boolean unique = true;
        for (CircuitMember member : node.members()) {
            unique &= used.add(member.name());
        }
        if (!unique) {
            diagnostics.report(node.isRecord()
                    ? TypeCheckerErrors.duplicateRecordVariable(node.name(), node.span())
                    : TypeCheckerErrors.duplicateCircuitMember(node.name(), node.span()));
        }

        if (node.isRecord()) {
            checkHasField(node, OWNER, PrimitiveType.ADDRESS);
            checkHasField(node, BALANCE, IntegerType.U64);
        }
        return null;
    }

    private void checkHasField(Circuit record, String need, Type expected) {
        Optional<CircuitMember> field = record.members().stream()
                .filter(member -> member.name().equals(need))
                .findFirst();
        if (field.isEmpty()) {
            diagnostics.report(TypeCheckerErrors.requiredRecordVariable(need, expected, record.span()));
        } else if (!expected.eqFlat(field.get().type())) {
            diagnostics.report(TypeCheckerErrors.recordVariableWrongType(need, expected, record.span()));
        }
    }

    @Override
    public Void visit(Block node) {
        symbolTable.enterScope();
        for (Statement statement : node.statements()) {
            statement.accept(this);
        }
        symbolTable.leaveScope();
        return null;
    }

    @Override
    public Void visit(ReturnStatement node) {
        if (node.expression() != null) {
            node.expression().accept(this);
        }
        hasReturn = true;
        return null;
    }

    @Override
    public Void visit(ConditionalStatement node) {
        node.condition().accept(this);
        node.then().accept(this);
        if (node.otherwise() != null) {
            node.otherwise().accept(this);
        }
        return null;
    }

    @Override
    public Void visit(DefinitionStatement node) {
        checkIdentType(node.type(), node.span());
        node.value().accept(this);
        Declaration declaration = node.kind() == DefinitionStatement.Kind.CONST
                ? new Declaration.Const()
                : new Declaration.Let();
        if (!symbolTable.insertVariable(node.variable(),
                new VariableSymbol(node.type(), node.variable().span(), declaration))) {
            diagnostics.report(TypeCheckerErrors.duplicateVariable(
                    node.variable().name(), node.variable().span()));
        }
        return null;
    }

    @Override
    public Void visit(ExpressionStatement node) {
        node.expression().accept(this);
        return null;
    }

    @Override
    public Void visit(VariableExpression node) {
        String name = node.identifier().name();
        if (symbolTable.lookupVariable(name).isEmpty()) {
            diagnostics.report(TypeCheckerErrors.unknownVariable(name, parent, node.span()));
        }
        return null;
    }

    @Override
    public Void visit(LiteralExpression node) {
        return null;
    }

    @Override
    public Void visit(CallExpression node) {
        String name = node.function().name();
        if (!isKnown(name, n -> symbolTable.lookupFunction(n).isPresent())) {
            diagnostics.report(TypeCheckerErrors.unknownFunction(name, parent, node.span()));
        }
        for (Expression argument : node.arguments()) {
            argument.accept(this);
        }
        return null;
    }

    /**
     * Checks that a declared type only refers to known circuits. A missing type is accepted.
     */
    private void checkIdentType(Type type, Span span) {
        if (type == null) {
            return;
        }
        if (type instanceof IdentifierType named) {
            String name = named.name().name();
            if (!isKnown(name, n -> symbolTable.lookupCircuit(n).isPresent())) {
                diagnostics.report(TypeCheckerErrors.unknownType(type, span));
            }
        } else if (type instanceof ArrayType array) {
            checkIdentType(array.elementType(), span);
        } else if (type instanceof TupleType tuple) {
            for (Type element : tuple.elements()) {
                checkIdentType(element, span);
            }
        }
    }

    private boolean isKnown(String name, Predicate<String> registered) {
        if (registered.test(name) || registered.test(QualifiedNames.newScope(scope, name, scopeSeparator))) {
            return true;
        }
        Optional<String> bound = importedNames.resolve(scope, name);
        return bound.isPresent() && registered.test(bound.get());
    }
}
