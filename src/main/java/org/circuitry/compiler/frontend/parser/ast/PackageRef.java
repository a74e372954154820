package org.circuitry.compiler.frontend.parser.ast;

import org.circuitry.compiler.model.Identifier;
import org.circuitry.compiler.model.Span;

/**
 * A package name followed by the access into it.
 *
 * @param name   The package name, matched against {@code src/<name>.leo}.
 * @param access What to import from the package.
 * @param span   The location of the package reference.
 */
public record PackageRef(Identifier name, PackageAccess access, Span span) {
}
