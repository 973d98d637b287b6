package io.github.superyaml.core;

/// Thrown when JSON text cannot be read into a {@link Value} or written back out.
public final class ValueFormatException extends SyamlException {

    private static final long serialVersionUID = 1L;

    public ValueFormatException(String message, Throwable cause) {
        super(ErrorKind.SERIALIZATION, message, cause);
    }
}
