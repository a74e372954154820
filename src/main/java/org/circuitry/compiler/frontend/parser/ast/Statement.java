package org.circuitry.compiler.frontend.parser.ast;

import org.circuitry.compiler.model.Span;

/**
 * A statement inside a function body.
 */
public interface Statement extends AstNode {

    Span span();
}
