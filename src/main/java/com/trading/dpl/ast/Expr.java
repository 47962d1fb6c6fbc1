package com.trading.dpl.ast;

import java.util.List;

/**
 * Expression nodes of a parsed script.
 */
public interface Expr {

    record Num(double value) implements Expr {
    }

    record Str(String value) implements Expr {
    }

    /** Interpolated string: literal text parts and expression parts. */
    record FStr(List<Part> parts) implements Expr {
        public FStr {
            parts = List.copyOf(parts);
        }

        public interface Part {
        }

        public record Text(String text) implements Part {
        }

        public record Interpolation(Expr expr) implements Part {
        }
    }

    record Bool(boolean value) implements Expr {
    }

    record Null() implements Expr {
    }

    record Ident(String name) implements Expr {
    }

    record ArrayLit(List<Expr> elements) implements Expr {
        public ArrayLit {
            elements = List.copyOf(elements);
        }
    }

    record Binary(Expr left, BinaryOp op, Expr right) implements Expr {
    }

    record Unary(UnaryOp op, Expr operand) implements Expr {
    }

    record Ternary(Expr condition, Expr thenExpr, Expr elseExpr) implements Expr {
    }

    record WhenBranch(Expr condition, Expr result) {
    }

    /** First branch whose condition is truthy wins; {@code elseExpr} may be null. */
    record When(List<WhenBranch> branches, Expr elseExpr) implements Expr {
        public When {
            branches = List.copyOf(branches);
        }
    }

    /** A call by name; {@code callee} may be package qualified ({@code pkg.fn}). */
    record Call(String callee, List<Expr> args) implements Expr {
        public Call {
            args = List.copyOf(args);
        }
    }

    /** {@code object.member} where object is a package name. */
    record Member(String object, String member) implements Expr {
    }

    /** {@code base[index]}; on a bare identifier a negative index reads history. */
    record Index(Expr base, Expr index) implements Expr {
    }

    /** {@code base[start:end]}; either bound may be null. */
    record Slice(Expr base, Expr start, Expr end) implements Expr {
    }

    record Spread(Expr inner) implements Expr {
    }

    record Lambda(List<String> params, Expr body) implements Expr {
        public Lambda {
            params = List.copyOf(params);
        }
    }

    /** {@code value |> stage1 |> stage2}; every stage must be a {@link Call}. */
    record Pipeline(Expr value, List<Expr> stages) implements Expr {
        public Pipeline {
            stages = List.copyOf(stages);
        }
    }
}
