package io.github.superyaml.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// The single mutable owner of a document root.
///
/// Values are immutable, so a write rebuilds the containers along the path
/// and swaps the root. Every structural read and write goes through a path;
/// callers never hold references into the tree across writes.
///
/// Not thread safe. One resolver run owns a tree for its whole duration.
public final class DocumentTree {

    private static final Logger LOG = Logger.getLogger(DocumentTree.class.getName());

    private Value root;

    public DocumentTree(Value root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    /// {@return the current document root}
    public Value root() {
        return root;
    }

    /// {@return the value at `path`, or empty when nothing is there}
    public Optional<Value> get(String path) {
        return ValuePath.get(root, path);
    }

    /// Replaces the value at `path`.
    ///
    /// The last step may add a new member to an existing object; every other
    /// step must already exist.
    ///
    /// @throws PathException if the path is malformed or an intermediate step is missing
    public void set(String path, Value value) {
        Objects.requireNonNull(value, "value must not be null");
        final var steps = ValuePath.parse(path);
        LOG.finer(() -> "Setting " + path);
        root = replaceAt(root, steps, 0, value, path);
    }

    private static Value replaceAt(Value current, List<PathStep> steps, int index, Value newValue, String path) {
        if (index == steps.size()) {
            return newValue;
        }
        final var step = steps.get(index);
        final boolean isLast = index == steps.size() - 1;

        if (step instanceof PathStep.Key key) {
            if (!(current instanceof ObjectValue obj)) {
                throw new PathException("path '" + path + "' does not point to object");
            }
            final var child = obj.get(key.name());
            if (child == null && !isLast) {
                throw new PathException("path '" + path + "' not found while setting value");
            }
            final var replaced = isLast ? newValue : replaceAt(child, steps, index + 1, newValue, path);
            final var out = new LinkedHashMap<String, Value>(obj.members());
            out.put(key.name(), replaced);
            return new ObjectValue(out);
        }

        final int i = ((PathStep.Index) step).index();
        if (!(current instanceof ArrayValue arr)) {
            throw new PathException("path '" + path + "' does not point to array");
        }
        if (i >= arr.elements().size()) {
            throw new PathException("array index out of bounds in path '" + path + "'");
        }
        final var replaced = replaceAt(arr.elements().get(i), steps, index + 1, newValue, path);
        final var out = new ArrayList<Value>(arr.elements());
        out.set(i, replaced);
        return new ArrayValue(out);
    }
}
