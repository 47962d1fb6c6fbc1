package com.trading.dpl.ast;

/** Binary operators, with their script spelling. */
public enum BinaryOp {
    ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"), POW("^"),
    GT(">"), LT("<"), GT_EQ(">="), LT_EQ("<="), EQ("=="), NOT_EQ("!="),
    AND("and"), OR("or");

    private final String symbol;

    BinaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
