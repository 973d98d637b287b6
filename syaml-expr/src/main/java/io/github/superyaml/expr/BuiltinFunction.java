package io.github.superyaml.expr;

import io.github.superyaml.core.ArrayValue;
import io.github.superyaml.core.NullValue;
import io.github.superyaml.core.NumberValue;
import io.github.superyaml.core.ObjectValue;
import io.github.superyaml.core.StringValue;
import io.github.superyaml.core.Value;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/// The fixed set of functions callable from expressions.
enum BuiltinFunction {

    MIN("min", 1, true) {
        @Override
        Value apply(List<Value> args) {
            double m = Double.POSITIVE_INFINITY;
            for (final var arg : args) {
                m = Math.min(m, ValueOps.asDouble(arg));
            }
            return ValueOps.number(m);
        }
    },
    MAX("max", 1, true) {
        @Override
        Value apply(List<Value> args) {
            double m = Double.NEGATIVE_INFINITY;
            for (final var arg : args) {
                m = Math.max(m, ValueOps.asDouble(arg));
            }
            return ValueOps.number(m);
        }
    },
    ABS("abs", 1, false) {
        @Override
        Value apply(List<Value> args) {
            return numeric(args, Math::abs);
        }
    },
    FLOOR("floor", 1, false) {
        @Override
        Value apply(List<Value> args) {
            return numeric(args, Math::floor);
        }
    },
    CEIL("ceil", 1, false) {
        @Override
        Value apply(List<Value> args) {
            return numeric(args, Math::ceil);
        }
    },
    ROUND("round", 1, false) {
        @Override
        Value apply(List<Value> args) {
            return numeric(args, BuiltinFunction::roundHalfAwayFromZero);
        }
    },
    LEN("len", 1, false) {
        @Override
        Value apply(List<Value> args) {
            final var arg = args.get(0);
            if (arg instanceof StringValue s) {
                return NumberValue.of(s.value().codePointCount(0, s.value().length()));
            }
            if (arg instanceof ArrayValue a) {
                return NumberValue.of(a.elements().size());
            }
            if (arg instanceof ObjectValue o) {
                return NumberValue.of(o.members().size());
            }
            throw new ExpressionException("len() expects string, array, or object");
        }
    },
    COALESCE("coalesce", 1, true) {
        @Override
        Value apply(List<Value> args) {
            for (final var arg : args) {
                if (!(arg instanceof NullValue)) {
                    return arg;
                }
            }
            return NullValue.of();
        }
    };

    private final String functionName;
    private final int arity;
    private final boolean variadic;

    BuiltinFunction(String functionName, int arity, boolean variadic) {
        this.functionName = functionName;
        this.arity = arity;
        this.variadic = variadic;
    }

    abstract Value apply(List<Value> args);

    static Optional<BuiltinFunction> byName(String name) {
        return Arrays.stream(values()).filter(f -> f.functionName.equals(name)).findFirst();
    }

    /// Checks the argument count, then applies the function.
    Value invoke(List<Value> args) {
        if (variadic && args.size() < arity) {
            throw new ExpressionException(functionName + " expects at least " + arity + " arguments, got " + args.size());
        }
        if (!variadic && args.size() != arity) {
            throw new ExpressionException(functionName + " expects " + arity + " arguments, got " + args.size());
        }
        return apply(args);
    }

    private static Value numeric(List<Value> args, DoubleUnaryOperator op) {
        return ValueOps.number(op.applyAsDouble(ValueOps.asDouble(args.get(0))));
    }

    private static double roundHalfAwayFromZero(double x) {
        if (Math.abs(x) >= 0x1p52) {
            return x;
        }
        return x < 0 ? -Math.round(-x) : Math.round(x);
    }
}
