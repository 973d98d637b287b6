package io.github.superyaml.core;

/// Thrown for a malformed path or a write to a location that does not exist.
public final class PathException extends SyamlException {

    private static final long serialVersionUID = 1L;

    public PathException(String message) {
        super(ErrorKind.PATH, message);
    }
}
