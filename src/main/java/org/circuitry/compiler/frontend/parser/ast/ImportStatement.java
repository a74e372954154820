package org.circuitry.compiler.frontend.parser.ast;

import org.circuitry.compiler.model.Span;

/**
 * A top-level {@code import} declaration, e.g. {@code import foo.bar as baz;}.
 *
 * @param packageRef The imported package and what to take from it.
 * @param span       The location of the declaration.
 */
public record ImportStatement(PackageRef packageRef, Span span) {
}
