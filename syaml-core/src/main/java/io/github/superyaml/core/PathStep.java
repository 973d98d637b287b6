package io.github.superyaml.core;

import java.util.Objects;

/// A single step of a {@link ValuePath}.
public sealed interface PathStep permits PathStep.Key, PathStep.Index {

    /// Object member step (by name).
    record Key(String name) implements PathStep {
        public Key {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /// Array element step (by index).
    record Index(int index) implements PathStep {
        public Index {
            if (index < 0) {
                throw new IllegalArgumentException("index must not be negative: " + index);
            }
        }
    }
}
