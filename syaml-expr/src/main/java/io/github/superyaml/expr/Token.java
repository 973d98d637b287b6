package io.github.superyaml.expr;

import java.util.Objects;

/// A lexical token.
///
/// `text` holds the decoded literal for `STRING`, the name for `IDENT`, the
/// digits for `NUMBER`, `true`/`false` for `BOOL` and the operator spelling
/// otherwise. `position` is the offset of the first character in the source.
public record Token(TokenKind kind, String text, int position) {

    public Token {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    /// {@return a short description for diagnostics}
    public String describe() {
        return switch (kind) {
            case EOF -> "end of input";
            case STRING -> "string \"" + text + "\"";
            case IDENT -> "identifier '" + text + "'";
            case NUMBER -> "number " + text;
            default -> "'" + text + "'";
        };
    }
}
