package io.github.superyaml.core;

import java.util.Objects;

/// Base class of every error raised while resolving or validating a document.
///
/// These are authoring-time configuration errors: the first one aborts the
/// whole operation, so each carries the exact path and expression text rather
/// than a list of problems.
public abstract class SyamlException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String detail;

    protected SyamlException(ErrorKind kind, String detail) {
        super(Objects.requireNonNull(kind, "kind must not be null").label() + ": " + detail);
        this.kind = kind;
        this.detail = detail;
    }

    protected SyamlException(ErrorKind kind, String detail, Throwable cause) {
        super(Objects.requireNonNull(kind, "kind must not be null").label() + ": " + detail, cause);
        this.kind = kind;
        this.detail = detail;
    }

    /// {@return the stage that failed}
    public ErrorKind kind() {
        return kind;
    }

    /// {@return the message without the stage prefix}
    public String detail() {
        return detail;
    }
}
