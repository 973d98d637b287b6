package io.github.superyaml.resolve;

import java.util.Optional;

/// Source of raw environment variable text.
@FunctionalInterface
public interface EnvProvider {

    /// {@return the raw value of `key`, or empty when it is not set}
    Optional<String> get(String key);
}
