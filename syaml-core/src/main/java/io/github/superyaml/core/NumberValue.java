package io.github.superyaml.core;

/// A JSON number, held either as a 64-bit integer or as a finite double.
///
/// Arithmetic results go through {@link #of(double)}, which normalizes any
/// whole result that fits a `long` to an {@link IntegerValue}. That is what
/// makes `2 + 2` produce `4` rather than `4.0`.
public sealed interface NumberValue extends Value permits IntegerValue, DecimalValue {

    /// Lower edge of the range accepted for integer normalization.
    double LONG_RANGE_MIN = -9.223372036854775808E18;
    /// Upper edge, exclusive: `2^63` itself does not fit a `long`.
    double LONG_RANGE_MAX = 9.223372036854775807E18;

    /// {@return this number as a `double`}
    double toDouble();

    /// {@return `true` if this number is a whole number within the `long` range}
    boolean isIntegral();

    /// {@return this number as a `long`}
    /// @throws ArithmeticException if {@link #isIntegral()} is `false`
    long toLong();

    @Override
    default String kindName() {
        return "number";
    }

    /// Creates a number from a `double`, normalizing whole values to integers.
    ///
    /// @param value a finite double
    /// @return an {@link IntegerValue} when `value` has no fractional part and fits a `long`,
    ///         otherwise a {@link DecimalValue}
    /// @throws IllegalArgumentException if `value` is NaN or infinite
    static NumberValue of(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Not a finite number: " + value);
        }
        if (value % 1.0 == 0.0 && value >= LONG_RANGE_MIN && value < LONG_RANGE_MAX) {
            return new IntegerValue((long) value);
        }
        return new DecimalValue(value);
    }

    static NumberValue of(long value) {
        return new IntegerValue(value);
    }
}
