package com.trading.dpl.ast;

/** Declared type of a script or function parameter. */
public enum TypeAnnotation {
    NUMBER, DECIMAL, STRING, BOOL, ARRAY, NULL
}
