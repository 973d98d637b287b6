package io.github.superyaml.constraints;

import io.github.superyaml.core.ErrorKind;
import io.github.superyaml.core.SyamlException;

import java.util.List;

/// Thrown when a constraint fails, cannot be evaluated, or can never hold.
public final class ConstraintException extends SyamlException {

    private static final long serialVersionUID = 1L;

    private final String path;
    private final List<String> expressions;

    public ConstraintException(String detail) {
        this(detail, null, List.of());
    }

    /// @param path        the normalized path being validated, or `null`
    /// @param expressions the constraint sources involved, possibly empty
    public ConstraintException(String detail, String path, List<String> expressions) {
        super(ErrorKind.CONSTRAINT, detail);
        this.path = path;
        this.expressions = List.copyOf(expressions);
    }

    /// {@return the normalized path, or `null` when the error is not tied to one}
    public String path() {
        return path;
    }

    /// {@return the constraint sources involved in the error}
    public List<String> expressions() {
        return expressions;
    }
}
