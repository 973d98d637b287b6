package io.github.superyaml.resolve;

import io.github.superyaml.core.BoolValue;
import io.github.superyaml.core.NullValue;
import io.github.superyaml.core.NumberValue;
import io.github.superyaml.core.StringValue;
import io.github.superyaml.core.Value;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Turns environment binding declarations into the `env` map seen by expressions.
public final class EnvBindings {

    private static final Logger LOG = Logger.getLogger(EnvBindings.class.getName());

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern FLOAT = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

    private EnvBindings() {}

    /// Resolves each binding against the provider.
    ///
    /// A set variable is parsed as a scalar. An unset one falls back to the
    /// binding's default, then to `null` for optional bindings.
    ///
    /// @param bindings symbol name to binding; `null` is treated as empty
    /// @param provider the environment to read
    /// @return symbol name to value, in the iteration order of `bindings`
    /// @throws EnvironmentException if a required variable is missing or unparseable
    public static Map<String, Value> resolve(Map<String, EnvBinding> bindings, EnvProvider provider) {
        Objects.requireNonNull(provider, "provider must not be null");
        if (bindings == null || bindings.isEmpty()) {
            return Map.of();
        }
        final var out = new LinkedHashMap<String, Value>();
        for (final var entry : bindings.entrySet()) {
            out.put(entry.getKey(), resolveOne(entry.getKey(), entry.getValue(), provider));
        }
        LOG.fine(() -> "Resolved " + out.size() + " env binding(s): " + out.keySet());
        return Collections.unmodifiableMap(out);
    }

    private static Value resolveOne(String symbol, EnvBinding binding, EnvProvider provider) {
        final var raw = provider.get(binding.key());
        if (raw.isPresent()) {
            LOG.finer(() -> "Env " + binding.key() + " is set for symbol " + symbol);
            try {
                return parseScalar(raw.get());
            } catch (IllegalArgumentException ex) {
                throw new EnvironmentException("failed to parse env '" + binding.key() + "': invalid scalar value");
            }
        }
        final var fallback = binding.defaultOption();
        if (fallback.isPresent()) {
            return fallback.get();
        }
        if (binding.required()) {
            throw new EnvironmentException("missing required environment variable '" + binding.key()
                    + "' for symbol '" + symbol + "'");
        }
        return NullValue.of();
    }

    /// Parses raw environment text the way a plain YAML scalar reads.
    /// @throws IllegalArgumentException on an unterminated quoted string
    static Value parseScalar(String raw) {
        final var text = raw.trim();
        switch (text) {
            case "true":
                return BoolValue.TRUE;
            case "false":
                return BoolValue.FALSE;
            case "null":
            case "~":
                return NullValue.of();
            default:
                break;
        }
        if (text.startsWith("\"") || text.startsWith("'")) {
            final char quote = text.charAt(0);
            if (text.length() < 2 || text.charAt(text.length() - 1) != quote) {
                throw new IllegalArgumentException("unterminated quoted scalar");
            }
            return StringValue.of(text.substring(1, text.length() - 1));
        }
        if (INTEGER.matcher(text).matches()) {
            final var big = new BigInteger(text);
            return big.bitLength() < Long.SIZE ? NumberValue.of(big.longValue()) : NumberValue.of(big.doubleValue());
        }
        if (FLOAT.matcher(text).matches()) {
            final double d = Double.parseDouble(text);
            if (Double.isFinite(d)) {
                return NumberValue.of(d);
            }
        }
        return StringValue.of(text);
    }
}
