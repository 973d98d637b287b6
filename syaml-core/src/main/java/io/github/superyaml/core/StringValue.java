package io.github.superyaml.core;

import java.util.Objects;

/// A JSON string.
public record StringValue(String value) implements Value {

    public StringValue {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static StringValue of(String value) {
        return new StringValue(value);
    }

    @Override
    public String kindName() {
        return "string";
    }

    @Override
    public String toString() {
        return ValueJson.write(this, false);
    }
}
