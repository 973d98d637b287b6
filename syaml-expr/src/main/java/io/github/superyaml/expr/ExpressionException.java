package io.github.superyaml.expr;

import io.github.superyaml.core.ErrorKind;
import io.github.superyaml.core.SyamlException;

/// Thrown when expression source cannot be tokenized or parsed, or when
/// evaluation fails in a way that retrying cannot fix.
public final class ExpressionException extends SyamlException {

    private static final long serialVersionUID = 1L;

    private final int position;

    /// Creates an exception with no known source position.
    public ExpressionException(String message) {
        super(ErrorKind.EXPRESSION, message);
        this.position = -1;
    }

    /// Creates an exception pointing at an offset in the expression source.
    public ExpressionException(String message, int position) {
        super(ErrorKind.EXPRESSION, message + " at " + position);
        this.position = position;
    }

    /// Creates a positioned exception with a suggestion appended after the offset.
    public ExpressionException(String message, int position, String hint) {
        super(ErrorKind.EXPRESSION, message + " at " + position + "; " + hint);
        this.position = position;
    }

    /// Returns the offset in the source where the error occurred, or -1 if unknown.
    public int position() {
        return position;
    }
}
