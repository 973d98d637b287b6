package io.github.superyaml.expr;

/// Kinds of token produced by {@link ExpressionLexer}.
public enum TokenKind {
    NUMBER,
    STRING,
    BOOL,
    NULL,
    IDENT,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    LPAREN,
    RPAREN,
    COMMA,
    DOT,
    BANG,
    EQ_EQ,
    NOT_EQ,
    LT,
    LTE,
    GT,
    GTE,
    AND_AND,
    OR_OR,
    EOF
}
