package io.github.superyaml.core;

/// A floating point JSON number.
///
/// Parsed documents may hold whole decimals such as `4.0`; values computed by
/// the expression evaluator never do (see {@link NumberValue#of(double)}).
public record DecimalValue(double value) implements NumberValue {

    public DecimalValue {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Not a finite number: " + value);
        }
    }

    @Override
    public double toDouble() {
        return value;
    }

    @Override
    public boolean isIntegral() {
        return value % 1.0 == 0.0 && value >= LONG_RANGE_MIN && value < LONG_RANGE_MAX;
    }

    @Override
    public long toLong() {
        if (!isIntegral()) {
            throw new ArithmeticException("not an integral value: " + value);
        }
        return (long) value;
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
