package org.circuitry.compiler.frontend.parser.ast;

import org.circuitry.compiler.model.Span;

/**
 * An expression inside a statement.
 */
public interface Expression extends AstNode {

    Span span();
}
