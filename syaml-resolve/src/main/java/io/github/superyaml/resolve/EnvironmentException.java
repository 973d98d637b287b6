package io.github.superyaml.resolve;

import io.github.superyaml.core.ErrorKind;
import io.github.superyaml.core.SyamlException;

/// Thrown when an environment binding cannot be satisfied.
public final class EnvironmentException extends SyamlException {

    private static final long serialVersionUID = 1L;

    public EnvironmentException(String detail) {
        super(ErrorKind.ENVIRONMENT, detail);
    }
}
