package com.trading.dpl.api;

/**
 * Runtime failure of a script evaluation.
 *
 * <p>
 * Any ScriptException aborts the row being evaluated; no partial output row is
 * ever emitted. Only the single-shot executor lets a script's ERROR block
 * intercept it.
 */
public class ScriptException extends RuntimeException {
    private final ErrorType errorType;
    private final String detail;

    public ScriptException(ErrorType errorType, String detail) {
        super(errorType + ": " + detail);
        this.errorType = errorType;
        this.detail = detail;
    }

    public ScriptException(ErrorType errorType, String message, ScriptException cause) {
        super(message, cause);
        this.errorType = errorType;
        this.detail = cause.detail();
    }

    public static ScriptException typeError(String detail) {
        return new ScriptException(ErrorType.TYPE_ERROR, detail);
    }

    public static ScriptException zeroDivision() {
        return new ScriptException(ErrorType.ZERO_DIVISION, "division by zero");
    }

    public static ScriptException undefinedVariable(String name) {
        return new ScriptException(ErrorType.UNDEFINED_VARIABLE, "undefined variable: " + name);
    }

    public static ScriptException undefinedFunction(String name) {
        return new ScriptException(ErrorType.UNDEFINED_FUNCTION, "undefined function: " + name);
    }

    public static ScriptException argumentMismatch(String detail) {
        return new ScriptException(ErrorType.ARGUMENT_MISMATCH, detail);
    }

    /**
     * Wraps this failure with the index of the row it aborted. The error type
     * and detail are preserved.
     */
    public ScriptException atRow(long rowIndex) {
        return new ScriptException(errorType, "Row " + rowIndex + " failed: " + getMessage(), this);
    }

    public ErrorType errorType() {
        return errorType;
    }

    /** The bare message, without type prefix or row context. Bound to {@code __error__} in ERROR blocks. */
    public String detail() {
        return detail;
    }
}
