package io.github.superyaml.resolve;

import java.util.Map;
import java.util.Optional;

/// Environment backed by a fixed map, for tests and embedding.
public record MapEnvProvider(Map<String, String> values) implements EnvProvider {

    public MapEnvProvider {
        values = Map.copyOf(values);
    }

    public static MapEnvProvider of(Map<String, String> values) {
        return new MapEnvProvider(values);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }
}
