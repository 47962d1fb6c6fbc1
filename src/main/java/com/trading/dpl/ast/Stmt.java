package com.trading.dpl.ast;

import java.util.List;

/**
 * Statement nodes of a parsed script.
 */
public interface Stmt {

    record Assign(String name, Expr value, boolean mutable) implements Stmt {
    }

    /** {@code [a, _, ...rest] = value}. */
    record Destructure(List<Pattern> patterns, Expr value) implements Stmt {
        public Destructure {
            patterns = List.copyOf(patterns);
        }
    }

    /** {@code elseBlock} may be null. */
    record If(Expr condition, List<Stmt> thenBlock, List<Stmt> elseBlock) implements Stmt {
        public If {
            thenBlock = List.copyOf(thenBlock);
            elseBlock = elseBlock == null ? null : List.copyOf(elseBlock);
        }
    }

    record Return(Expr value) implements Stmt {
    }

    record ExprStmt(Expr expr) implements Stmt {
    }

    /** Destructuring targets. */
    interface Pattern {
    }

    record Bind(String name) implements Pattern {
    }

    record Ignore() implements Pattern {
    }

    /** Collects the remaining elements; ends the pattern. */
    record Rest(String name) implements Pattern {
    }
}
