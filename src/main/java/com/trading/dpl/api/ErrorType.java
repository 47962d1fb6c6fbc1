package com.trading.dpl.api;

/**
 * Classification of failures raised while evaluating a script.
 */
public enum ErrorType {
    TYPE_ERROR,
    ZERO_DIVISION,
    UNDEFINED_VARIABLE,
    UNDEFINED_FUNCTION,
    ARGUMENT_MISMATCH,
    /** Reserved: indexing currently yields null instead of failing. */
    INDEX_OUT_OF_BOUNDS,
    /** Reserved. */
    NULL_REFERENCE
}
