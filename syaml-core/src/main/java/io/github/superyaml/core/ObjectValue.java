package io.github.superyaml.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A JSON object.
///
/// Members keep the insertion order of the map they were created from, so
/// serialization is deterministic. Equality ignores member order.
public record ObjectValue(Map<String, Value> members) implements Value {

    public ObjectValue {
        Objects.requireNonNull(members, "members must not be null");
        final var copy = new LinkedHashMap<String, Value>(members.size());
        for (final var entry : members.entrySet()) {
            copy.put(Objects.requireNonNull(entry.getKey(), "member name must not be null"),
                    Objects.requireNonNull(entry.getValue(), "member value must not be null"));
        }
        members = Collections.unmodifiableMap(copy);
    }

    public static ObjectValue of(Map<String, ? extends Value> members) {
        return new ObjectValue(new LinkedHashMap<String, Value>(members));
    }

    /// {@return the member with the given name, or `null` when absent}
    public Value get(String name) {
        return members.get(name);
    }

    @Override
    public String kindName() {
        return "object";
    }

    @Override
    public String toString() {
        return ValueJson.write(this, false);
    }
}
