package io.github.superyaml.expr;

import java.util.List;
import java.util.Objects;

/// Expression AST.
///
/// The grammar is fixed, so the node set is closed: literals, dotted variable
/// references, unary and binary operations and calls to built-in functions.
/// Nodes are immutable.
public sealed interface Expr permits
        Expr.NumberLiteral,
        Expr.StringLiteral,
        Expr.BoolLiteral,
        Expr.NullLiteral,
        Expr.Var,
        Expr.Unary,
        Expr.Binary,
        Expr.Call {

    record NumberLiteral(double value) implements Expr {}

    record StringLiteral(String value) implements Expr {
        public StringLiteral {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record BoolLiteral(boolean value) implements Expr {}

    record NullLiteral() implements Expr {}

    /// Dotted reference such as `a.b.c`, `env.NAME` or `value.min`.
    record Var(List<String> segments) implements Expr {
        public Var {
            Objects.requireNonNull(segments, "segments must not be null");
            if (segments.isEmpty()) {
                throw new IllegalArgumentException("Var must have at least one segment");
            }
            segments = List.copyOf(segments);
        }

        /// {@return the segments joined with `.`}
        public String dotted() {
            return String.join(".", segments);
        }
    }

    record Unary(UnaryOp op, Expr operand) implements Expr {
        public Unary {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    record Binary(BinaryOp op, Expr left, Expr right) implements Expr {
        public Binary {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record Call(String name, List<Expr> args) implements Expr {
        public Call {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(args, "args must not be null");
            args = List.copyOf(args);
        }
    }

    enum UnaryOp {
        NEG("-"),
        NOT("!");

        private final String symbol;

        UnaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    enum BinaryOp {
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),
        EQ("=="),
        NOT_EQ("!="),
        LT("<"),
        LTE("<="),
        GT(">"),
        GTE(">="),
        AND("&&"),
        OR("||");

        private final String symbol;

        BinaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /// {@return `true` for `< <= > >= == !=`}
        public boolean isComparison() {
            return switch (this) {
                case EQ, NOT_EQ, LT, LTE, GT, GTE -> true;
                default -> false;
            };
        }

        /// {@return the operator that holds when the operands are swapped, `a < b` iff `b > a`}
        public BinaryOp flipped() {
            return switch (this) {
                case LT -> GT;
                case LTE -> GTE;
                case GT -> LT;
                case GTE -> LTE;
                default -> this;
            };
        }
    }
}
