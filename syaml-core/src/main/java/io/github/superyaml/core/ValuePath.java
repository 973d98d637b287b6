package io.github.superyaml.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Normalized locators into a {@link Value} tree.
///
/// A path is either the root `$` or `$` followed by `.key` and `[index]`
/// steps, for example `$.services[0].port`. Paths produced by
/// {@link #child(String, String)} and {@link #index(String, int)} always
/// re-parse to the same steps.
///
/// Keys containing `.` or `[` cannot be addressed.
public final class ValuePath {

    public static final String ROOT = "$";

    private ValuePath() {}

    /// Parses a path into its steps.
    /// @param path a path starting with `$`
    /// @return the steps, empty for the root
    /// @throws PathException if the path is malformed
    public static List<PathStep> parse(String path) {
        Objects.requireNonNull(path, "path must not be null");
        if (ROOT.equals(path)) {
            return List.of();
        }
        if (!path.startsWith("$.") && !path.startsWith("$[")) {
            throw new PathException("invalid path '" + path + "'; expected to start with '$.'");
        }

        final var steps = new ArrayList<PathStep>();
        final var current = new StringBuilder();
        int i = 1;
        while (i < path.length()) {
            final char c = path.charAt(i);
            if (c == '.') {
                flushKey(current, steps);
                i++;
                continue;
            }
            if (c == '[') {
                flushKey(current, steps);
                final int close = path.indexOf(']', i + 1);
                if (close < 0) {
                    throw new PathException("invalid array path segment in '" + path + "'");
                }
                final var digits = path.substring(i + 1, close);
                steps.add(new PathStep.Index(parseIndex(digits, path)));
                i = close + 1;
                continue;
            }
            current.append(c);
            i++;
        }
        flushKey(current, steps);
        return List.copyOf(steps);
    }

    private static void flushKey(StringBuilder current, List<PathStep> steps) {
        if (current.length() > 0) {
            steps.add(new PathStep.Key(current.toString()));
            current.setLength(0);
        }
    }

    private static int parseIndex(String digits, String path) {
        if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
            throw new PathException("invalid array index '" + digits + "' in '" + path + "'");
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException ex) {
            throw new PathException("invalid array index '" + digits + "' in '" + path + "'");
        }
    }

    /// Renders steps back into path text.
    public static String render(List<PathStep> steps) {
        final var sb = new StringBuilder(ROOT);
        for (final var step : steps) {
            if (step instanceof PathStep.Key key) {
                sb.append('.').append(key.name());
            } else if (step instanceof PathStep.Index idx) {
                sb.append('[').append(idx.index()).append(']');
            }
        }
        return sb.toString();
    }

    public static String child(String parent, String key) {
        return parent + "." + key;
    }

    public static String index(String parent, int index) {
        return parent + "[" + index + "]";
    }

    /// Adds the `$.` prefix to shorthand paths: `a.b` becomes `$.a.b`.
    public static String normalize(String path) {
        Objects.requireNonNull(path, "path must not be null");
        if (ROOT.equals(path) || path.startsWith("$.") || path.startsWith("$[")) {
            return path;
        }
        return "$." + path;
    }

    /// {@return the path of the enclosing object or array, empty for the root or a malformed path}
    public static Optional<String> parent(String path) {
        final List<PathStep> steps;
        try {
            steps = parse(normalize(path));
        } catch (PathException ex) {
            return Optional.empty();
        }
        if (steps.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(render(steps.subList(0, steps.size() - 1)));
    }

    /// Appends a relative path to a base path. Both may be shorthand.
    /// `join("$.session", "min")` is `$.session.min`; a root on either side yields the other.
    public static String join(String base, String relative) {
        final var baseNorm = normalize(base);
        final var relNorm = normalize(relative);
        if (ROOT.equals(relNorm)) {
            return baseNorm;
        }
        if (ROOT.equals(baseNorm)) {
            return relNorm;
        }
        return baseNorm + relNorm.substring(1);
    }

    /// Looks up the value at a path.
    /// @return the value, or empty when the path is malformed or addresses nothing
    public static Optional<Value> get(Value root, String path) {
        Objects.requireNonNull(root, "root must not be null");
        final List<PathStep> steps;
        try {
            steps = parse(path);
        } catch (PathException ex) {
            return Optional.empty();
        }
        return get(root, steps);
    }

    public static Optional<Value> get(Value root, List<PathStep> steps) {
        Value current = root;
        for (final var step : steps) {
            current = stepInto(current, step);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    /// Follows object keys only; used for dotted references inside expressions.
    public static Optional<Value> lookupKeys(Value root, List<String> keys) {
        Value current = root;
        for (final var key : keys) {
            if (!(current instanceof ObjectValue obj)) {
                return Optional.empty();
            }
            current = obj.get(key);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    private static Value stepInto(Value current, PathStep step) {
        if (step instanceof PathStep.Key key) {
            return current instanceof ObjectValue obj ? obj.get(key.name()) : null;
        }
        final int i = ((PathStep.Index) step).index();
        if (current instanceof ArrayValue arr && i < arr.elements().size()) {
            return arr.elements().get(i);
        }
        return null;
    }
}
