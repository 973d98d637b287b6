package io.github.superyaml.resolve;

import io.github.superyaml.core.Value;

import java.util.Objects;
import java.util.Optional;

/// Declares how one `env.SYMBOL` is filled from the environment.
///
/// @param key          the environment variable to read
/// @param required     whether a missing variable with no default is an error
/// @param defaultValue used when the variable is not set; may be `null`
public record EnvBinding(String key, boolean required, Value defaultValue) {

    public EnvBinding {
        Objects.requireNonNull(key, "key must not be null");
    }

    public static EnvBinding required(String key) {
        return new EnvBinding(key, true, null);
    }

    public static EnvBinding optional(String key) {
        return new EnvBinding(key, false, null);
    }

    public static EnvBinding withDefault(String key, Value defaultValue) {
        return new EnvBinding(key, false, Objects.requireNonNull(defaultValue, "defaultValue must not be null"));
    }

    public Optional<Value> defaultOption() {
        return Optional.ofNullable(defaultValue);
    }
}
