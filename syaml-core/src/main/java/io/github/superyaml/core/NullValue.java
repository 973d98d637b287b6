package io.github.superyaml.core;

/// The JSON `null` value.
public record NullValue() implements Value {

    private static final NullValue INSTANCE = new NullValue();

    /// {@return the shared `null` instance}
    public static NullValue of() {
        return INSTANCE;
    }

    @Override
    public String kindName() {
        return "null";
    }

    @Override
    public String toString() {
        return "null";
    }
}
