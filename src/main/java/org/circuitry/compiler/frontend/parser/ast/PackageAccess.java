package org.circuitry.compiler.frontend.parser.ast;

import org.circuitry.compiler.model.Span;

import java.util.List;

/**
 * What an import takes from a package. The variants nest: a sub-package carries its own
 * access, and a list applies several accesses to the same package.
 */
public sealed interface PackageAccess
        permits PackageAccess.Star, PackageAccess.SymbolAccess, PackageAccess.SubPackage, PackageAccess.Multiple {

    /**
     * {@code foo.*}: every declaration of the package.
     *
     * @param span The location of the wildcard.
     */
    record Star(Span span) implements PackageAccess {}

    /**
     * {@code foo.bar} or {@code foo.bar as baz}: a single circuit or function.
     *
     * @param symbol The imported symbol.
     */
    record SymbolAccess(ImportSymbol symbol) implements PackageAccess {}

    /**
     * {@code foo.inner.*}: descend into a nested package.
     *
     * @param packageRef The nested package reference.
     */
    record SubPackage(PackageRef packageRef) implements PackageAccess {}

    /**
     * {@code foo.(a, b)}: several accesses into the same package, applied in order.
     *
     * @param accesses The accesses.
     */
    record Multiple(List<PackageAccess> accesses) implements PackageAccess {
        public Multiple {
            accesses = List.copyOf(accesses);
        }
    }
}
