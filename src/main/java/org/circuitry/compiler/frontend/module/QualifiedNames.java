package org.circuitry.compiler.frontend.module;

/**
 * Builds the names under which imported declarations are stored, by joining the owning
 * program's name with the local name of the declaration.
 */
public final class QualifiedNames {

    public static final String DEFAULT_SEPARATOR = "_";

    private QualifiedNames() {
    }

    /**
     * Joins a scope and a local name with the given separator, e.g. {@code foo_bar}.
     * @param outer     The owning program's name.
     * @param inner     The local name.
     * @param separator The separator.
     * @return The qualified name.
     */
    public static String newScope(String outer, String inner, String separator) {
        return outer + separator + inner;
    }
}
