package com.trading.dpl.ast;

/** A package-level variable definition. */
public record VariableDef(String name, Expr value, boolean mutable) {
}
