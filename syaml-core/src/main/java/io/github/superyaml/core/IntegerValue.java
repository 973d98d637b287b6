package io.github.superyaml.core;

/// An integral JSON number.
public record IntegerValue(long value) implements NumberValue {

    @Override
    public double toDouble() {
        return value;
    }

    @Override
    public boolean isIntegral() {
        return true;
    }

    @Override
    public long toLong() {
        return value;
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
