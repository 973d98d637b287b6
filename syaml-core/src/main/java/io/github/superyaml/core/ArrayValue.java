package io.github.superyaml.core;

import java.util.List;
import java.util.Objects;

/// A JSON array. The element list is an immutable copy.
public record ArrayValue(List<Value> elements) implements Value {

    public ArrayValue {
        Objects.requireNonNull(elements, "elements must not be null");
        elements = List.copyOf(elements);
    }

    public static ArrayValue of(List<? extends Value> elements) {
        return new ArrayValue(List.copyOf(elements));
    }

    @Override
    public String kindName() {
        return "array";
    }

    @Override
    public String toString() {
        return ValueJson.write(this, false);
    }
}
