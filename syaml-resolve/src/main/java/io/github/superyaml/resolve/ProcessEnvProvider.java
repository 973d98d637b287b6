package io.github.superyaml.resolve;

import java.util.Optional;

/// Reads the process environment.
public final class ProcessEnvProvider implements EnvProvider {

    public static final ProcessEnvProvider INSTANCE = new ProcessEnvProvider();

    private ProcessEnvProvider() {}

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key));
    }
}
