package org.circuitry.compiler.frontend.parser.ast;

/**
 * Visitor over the declarations, statements and expressions of a {@link Program}.
 *
 * @param <R> The result type of each visit.
 */
public interface AstVisitor<R> {

    R visit(Program node);

    R visit(Function node);

    R visit(Circuit node);

    R visit(Block node);

    R visit(ReturnStatement node);

    R visit(ConditionalStatement node);

    R visit(DefinitionStatement node);

    R visit(ExpressionStatement node);

    R visit(VariableExpression node);

    R visit(LiteralExpression node);

    R visit(CallExpression node);
}
