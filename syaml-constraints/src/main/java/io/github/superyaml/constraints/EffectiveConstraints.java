package io.github.superyaml.constraints;

import io.github.superyaml.core.ValuePath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/// Merges document-level constraints with constraints declared on types.
///
/// A type may constrain paths relative to wherever it is used. For every
/// type hint `path -> type`, the type's relative constraints are re-keyed under
/// `path` and appended after any constraints already present there.
public final class EffectiveConstraints {

    private static final Logger LOG = Logger.getLogger(EffectiveConstraints.class.getName());

    private EffectiveConstraints() {}

    /// @param topLevel        constraints keyed by document path
    /// @param typeHints       document path to type name
    /// @param typeConstraints type name to (relative path to constraints); `$` is the typed value itself
    /// @return path to constraint list, sorted by path
    public static Map<String, List<String>> build(
            Map<String, List<String>> topLevel,
            Map<String, String> typeHints,
            Map<String, Map<String, List<String>>> typeConstraints) {
        final var out = new TreeMap<String, List<String>>();
        topLevel.forEach((path, expressions) -> out.put(path, new ArrayList<>(expressions)));

        for (final var hint : new TreeMap<>(typeHints).entrySet()) {
            final var local = typeConstraints.get(hint.getValue());
            if (local == null) {
                continue;
            }
            for (final var entry : local.entrySet()) {
                final var absolute = ValuePath.join(hint.getKey(), entry.getKey());
                out.computeIfAbsent(absolute, k -> new ArrayList<>()).addAll(entry.getValue());
                LOG.finer(() -> "Type " + hint.getValue() + " contributes " + entry.getValue().size()
                        + " constraint(s) at " + absolute);
            }
        }

        final var result = new TreeMap<String, List<String>>();
        out.forEach((path, expressions) -> result.put(path, List.copyOf(expressions)));
        return Collections.unmodifiableMap(result);
    }
}
