package io.github.superyaml.expr;

import io.github.superyaml.core.Value;

import java.util.Objects;

/// Outcome of evaluating an expression.
///
/// `Unresolved` means a referenced path is still pending and the caller may
/// retry on a later pass. `Fatal` means retrying cannot help.
public sealed interface EvalResult permits EvalResult.Success, EvalResult.Unresolved, EvalResult.Fatal {

    record Success(Value value) implements EvalResult {
        public Success {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /// @param path the absolute path (`$.a.b`) of the pending reference
    record Unresolved(String path) implements EvalResult {
        public Unresolved {
            Objects.requireNonNull(path, "path must not be null");
        }
    }

    record Fatal(ExpressionException error) implements EvalResult {
        public Fatal {
            Objects.requireNonNull(error, "error must not be null");
        }
    }

    /// {@return the value of a `Success`}
    /// @throws ExpressionException the wrapped error of a `Fatal`
    /// @throws IllegalStateException for `Unresolved`
    default Value orThrow() {
        if (this instanceof Success s) {
            return s.value();
        }
        if (this instanceof Fatal f) {
            throw f.error();
        }
        throw new IllegalStateException("unresolved dependency: " + ((Unresolved) this).path());
    }
}
