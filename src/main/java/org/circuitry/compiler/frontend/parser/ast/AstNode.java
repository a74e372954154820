package org.circuitry.compiler.frontend.parser.ast;

/**
 * Base interface for all nodes of the abstract syntax tree that take part in traversal.
 */
public interface AstNode {

    /**
     * Dispatches to the visitor method for this node type.
     * @param visitor The visitor.
     * @param <R>     The visitor's result type.
     * @return The visitor's result.
     */
    <R> R accept(AstVisitor<R> visitor);
}
