package org.circuitry.compiler.diagnostics;

import org.circuitry.compiler.model.Span;

/**
 * A single message reported during compilation.
 *
 * @param severity The severity of the message.
 * @param code     A stable identifier of the rule that produced the message.
 * @param message  The human-readable message.
 * @param span     Where the problem was found.
 */
public record Diagnostic(Severity severity, String code, String message, Span span) {

    /**
     * The severity of a diagnostic.
     */
    public enum Severity {
        ERROR
    }

    @Override
    public String toString() {
        return severity + " " + span + ": [" + code + "] " + message;
    }
}
