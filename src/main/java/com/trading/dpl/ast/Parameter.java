package com.trading.dpl.ast;

/**
 * A named parameter of a script or function.
 *
 * @param type         declared type, may be null
 * @param defaultValue expression evaluated at call time when the argument is
 *                     omitted, may be null
 */
public record Parameter(String name, TypeAnnotation type, Expr defaultValue) {

    public static Parameter of(String name) {
        return new Parameter(name, null, null);
    }

    public static Parameter of(String name, TypeAnnotation type) {
        return new Parameter(name, type, null);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
