package com.trading.dpl.ast;

public enum UnaryOp {
    NEG("-"), NOT("not");

    private final String symbol;

    UnaryOp(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
