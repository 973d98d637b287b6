package io.github.superyaml.expr;

import io.github.superyaml.core.Value;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Read-only view an expression is evaluated against.
///
/// @param data            the document root, possibly still holding unresolved expression strings
/// @param env             resolved environment bindings, addressed as `env.NAME`
/// @param unresolvedPaths paths (`$.a.b`) whose values are not yet safe to read
/// @param currentValue    the value under constraint, or `null` outside constraint evaluation
/// @param currentScope    the object enclosing `currentValue`, or `null` when there is none
public record EvalContext(
        Value data,
        Map<String, Value> env,
        Set<String> unresolvedPaths,
        Value currentValue,
        Value currentScope
) {
    public EvalContext {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(env, "env must not be null");
        Objects.requireNonNull(unresolvedPaths, "unresolvedPaths must not be null");
    }

    /// Context for derived values and interpolations.
    public static EvalContext forResolution(Value data, Map<String, Value> env, Set<String> unresolvedPaths) {
        return new EvalContext(data, env, unresolvedPaths, null, null);
    }

    /// Context for a constraint on `currentValue`. Nothing is unresolved at this stage.
    public static EvalContext forConstraint(Value data, Map<String, Value> env, Value currentValue, Value currentScope) {
        Objects.requireNonNull(currentValue, "currentValue must not be null");
        return new EvalContext(data, env, Set.of(), currentValue, currentScope);
    }

    public Optional<Value> value() {
        return Optional.ofNullable(currentValue);
    }

    public Optional<Value> scope() {
        return Optional.ofNullable(currentScope);
    }
}
