package org.circuitry.compiler.diagnostics;

import org.circuitry.compiler.frontend.parser.ast.type.Type;
import org.circuitry.compiler.model.Span;

/**
 * Catalogue of the errors reported by the type checker. Each factory builds an error
 * {@link Diagnostic} carrying a stable code so callers and tests can tell the rules apart
 * without matching on message text.
 */
public final class TypeCheckerErrors {

    public static final String DUPLICATE_VARIABLE = "duplicate-variable";
    public static final String FUNCTION_HAS_NO_RETURN = "function-has-no-return";
    public static final String DUPLICATE_CIRCUIT_MEMBER = "duplicate-circuit-member";
    public static final String DUPLICATE_RECORD_VARIABLE = "duplicate-record-variable";
    public static final String REQUIRED_RECORD_VARIABLE = "required-record-variable";
    public static final String RECORD_VARIABLE_WRONG_TYPE = "record-variable-wrong-type";
    public static final String UNKNOWN_TYPE = "unknown-type";
    public static final String UNKNOWN_VARIABLE = "unknown-variable";
    public static final String UNKNOWN_FUNCTION = "unknown-function";

    private TypeCheckerErrors() {
    }

    public static Diagnostic duplicateVariable(String name, Span span) {
        return error(DUPLICATE_VARIABLE,
                "Duplicate definition found for variable `" + name + "`.", span);
    }

    public static Diagnostic functionHasNoReturn(String function, Span span) {
        return error(FUNCTION_HAS_NO_RETURN,
                "The function `" + function + "` has no return statement.", span);
    }

    public static Diagnostic duplicateCircuitMember(String circuit, Span span) {
        return error(DUPLICATE_CIRCUIT_MEMBER,
                "Circuit `" + circuit + "` must have unique member names.", span);
    }

    public static Diagnostic duplicateRecordVariable(String record, Span span) {
        return error(DUPLICATE_RECORD_VARIABLE,
                "Record `" + record + "` must have unique variable names.", span);
    }

    public static Diagnostic requiredRecordVariable(String name, Type expected, Span span) {
        return error(REQUIRED_RECORD_VARIABLE,
                "The `record` type requires the variable `" + name + ": " + expected + "`.", span);
    }

    public static Diagnostic recordVariableWrongType(String name, Type expected, Span span) {
        return error(RECORD_VARIABLE_WRONG_TYPE,
                "The field `" + name + "` in a `record` must have type `" + expected + "`.", span);
    }

    public static Diagnostic unknownType(Type type, Span span) {
        return error(UNKNOWN_TYPE, "Unknown type `" + type + "`.", span);
    }

    public static Diagnostic unknownVariable(String name, String function, Span span) {
        return error(UNKNOWN_VARIABLE,
                "Unknown variable `" + name + "` in function `" + function + "`.", span);
    }

    public static Diagnostic unknownFunction(String name, String function, Span span) {
        return error(UNKNOWN_FUNCTION,
                "Unknown function `" + name + "` called from function `" + function + "`.", span);
    }

    private static Diagnostic error(String code, String message, Span span) {
        return new Diagnostic(Diagnostic.Severity.ERROR, code, message, span);
    }
}
