package io.github.superyaml.expr;

import io.github.superyaml.core.ArrayValue;
import io.github.superyaml.core.BoolValue;
import io.github.superyaml.core.NumberValue;
import io.github.superyaml.core.ObjectValue;
import io.github.superyaml.core.StringValue;
import io.github.superyaml.core.Value;

import java.util.function.DoubleBinaryOperator;

/// Operator semantics. All arithmetic runs in double precision and goes
/// through {@link #number(double)}, so whole results come back as integers.
final class ValueOps {

    private ValueOps() {}

    static Value unary(Expr.UnaryOp op, Value operand) {
        return switch (op) {
            case NEG -> number(-asDouble(operand));
            case NOT -> BoolValue.of(!asBool(operand));
        };
    }

    static Value binary(Expr.BinaryOp op, Value left, Value right) {
        return switch (op) {
            case ADD -> add(left, right);
            case SUB -> arithmetic(left, right, (a, b) -> a - b);
            case MUL -> arithmetic(left, right, (a, b) -> a * b);
            case DIV -> divide(left, right);
            case MOD -> modulo(left, right);
            case EQ -> BoolValue.of(sameValue(left, right));
            case NOT_EQ -> BoolValue.of(!sameValue(left, right));
            case LT -> BoolValue.of(asDouble(left) < asDouble(right));
            case LTE -> BoolValue.of(asDouble(left) <= asDouble(right));
            case GT -> BoolValue.of(asDouble(left) > asDouble(right));
            case GTE -> BoolValue.of(asDouble(left) >= asDouble(right));
            // both sides are already evaluated; there is no short-circuit
            case AND -> BoolValue.of(asBool(left) & asBool(right));
            case OR -> BoolValue.of(asBool(left) | asBool(right));
        };
    }

    private static Value add(Value left, Value right) {
        if (left instanceof StringValue || right instanceof StringValue) {
            return StringValue.of(left.toDisplayString() + right.toDisplayString());
        }
        return arithmetic(left, right, Double::sum);
    }

    private static Value arithmetic(Value left, Value right, DoubleBinaryOperator op) {
        return number(op.applyAsDouble(asDouble(left), asDouble(right)));
    }

    private static Value divide(Value left, Value right) {
        final double lhs = asDouble(left);
        final double rhs = asDouble(right);
        if (rhs == 0.0) {
            throw new ExpressionException("division by zero");
        }
        return number(lhs / rhs);
    }

    private static Value modulo(Value left, Value right) {
        final long lhs = asLong(left);
        final long rhs = asLong(right);
        if (rhs == 0) {
            throw new ExpressionException("modulo by zero");
        }
        return NumberValue.of(lhs % rhs);
    }

    /// Structural equality, except that numbers compare by value (`1 == 1.0`).
    static boolean sameValue(Value left, Value right) {
        if (left instanceof NumberValue l && right instanceof NumberValue r) {
            if (l.isIntegral() && r.isIntegral()) {
                return l.toLong() == r.toLong();
            }
            return l.toDouble() == r.toDouble();
        }
        if (left instanceof ArrayValue l && right instanceof ArrayValue r) {
            if (l.elements().size() != r.elements().size()) {
                return false;
            }
            for (int i = 0; i < l.elements().size(); i++) {
                if (!sameValue(l.elements().get(i), r.elements().get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof ObjectValue l && right instanceof ObjectValue r) {
            if (!l.members().keySet().equals(r.members().keySet())) {
                return false;
            }
            for (final var entry : l.members().entrySet()) {
                if (!sameValue(entry.getValue(), r.members().get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        return left.equals(right);
    }

    /// Converts a computed double into a number value.
    /// @throws ExpressionException for NaN or infinite results
    static NumberValue number(double value) {
        if (!Double.isFinite(value)) {
            throw new ExpressionException("invalid numeric result " + value);
        }
        return NumberValue.of(value);
    }

    static double asDouble(Value value) {
        if (value instanceof NumberValue n) {
            return n.toDouble();
        }
        throw new ExpressionException("expected number, got " + value.kindName());
    }

    static long asLong(Value value) {
        if (value instanceof NumberValue n && n.isIntegral()) {
            return n.toLong();
        }
        if (value instanceof NumberValue n) {
            throw new ExpressionException("expected integer, got non-integral number " + n);
        }
        throw new ExpressionException("expected integer, got " + value.kindName());
    }

    static boolean asBool(Value value) {
        if (value instanceof BoolValue b) {
            return b.value();
        }
        throw new ExpressionException("expected boolean, got " + value.kindName());
    }
}
