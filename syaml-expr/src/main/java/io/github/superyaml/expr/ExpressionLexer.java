package io.github.superyaml.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Tokenizer for expression source text.
///
/// Recognizes numbers with at most one `.`, double-quoted strings with
/// `\\ \" \n \t \r` escapes (any other escaped character passes through),
/// `true`/`false`/`null`, identifiers, single-character punctuation and the
/// operators `== != <= >= && || < >`. The stream always ends with an `EOF` token.
final class ExpressionLexer {

    private static final Logger LOG = Logger.getLogger(ExpressionLexer.class.getName());

    /// Ceiling on tokens per expression, excluding the trailing `EOF`.
    static final int MAX_TOKENS = 4096;

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;

    private ExpressionLexer(String source) {
        this.source = source;
    }

    /// Tokenizes expression source.
    /// @throws ExpressionException on an unterminated string, an unknown character,
    ///         a lone `=`, `&` or `|`, or too many tokens
    static List<Token> tokenize(String source) {
        Objects.requireNonNull(source, "source must not be null");
        final var lexer = new ExpressionLexer(source);
        lexer.run();
        LOG.finest(() -> "Tokens for '" + source + "': " + lexer.tokens);
        return List.copyOf(lexer.tokens);
    }

    private void run() {
        while (pos < source.length()) {
            final char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }
            if (c >= '0' && c <= '9') {
                lexNumber();
            } else if (c == '"') {
                lexString();
            } else if (isIdentStart(c)) {
                lexIdentifier();
            } else {
                lexOperator(c);
            }
        }
        tokens.add(new Token(TokenKind.EOF, "", source.length()));
    }

    private void add(TokenKind kind, String text, int start) {
        if (tokens.size() >= MAX_TOKENS) {
            throw new ExpressionException("expression exceeds max token count (" + MAX_TOKENS + ")");
        }
        tokens.add(new Token(kind, text, start));
    }

    private void lexNumber() {
        final int start = pos;
        boolean seenDot = false;
        while (pos < source.length()) {
            final char c = source.charAt(pos);
            if (c >= '0' && c <= '9') {
                pos++;
            } else if (c == '.' && !seenDot) {
                seenDot = true;
                pos++;
            } else {
                break;
            }
        }
        add(TokenKind.NUMBER, source.substring(start, pos), start);
    }

    private void lexString() {
        final int start = pos;
        pos++; // opening quote
        final var out = new StringBuilder();
        while (pos < source.length()) {
            final char c = source.charAt(pos++);
            if (c == '"') {
                add(TokenKind.STRING, out.toString(), start);
                return;
            }
            if (c != '\\') {
                out.append(c);
                continue;
            }
            if (pos >= source.length()) {
                throw new ExpressionException("unterminated escape sequence", start);
            }
            final char esc = source.charAt(pos++);
            switch (esc) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                default -> out.append(esc);
            }
        }
        throw new ExpressionException("unterminated string literal starting", start);
    }

    private void lexIdentifier() {
        final int start = pos;
        while (pos < source.length() && isIdentContinue(source.charAt(pos))) {
            pos++;
        }
        final var word = source.substring(start, pos);
        switch (word) {
            case "true", "false" -> add(TokenKind.BOOL, word, start);
            case "null" -> add(TokenKind.NULL, word, start);
            default -> add(TokenKind.IDENT, word, start);
        }
    }

    private void lexOperator(char c) {
        final int start = pos;
        switch (c) {
            case '+' -> single(TokenKind.PLUS, start);
            case '-' -> single(TokenKind.MINUS, start);
            case '*' -> single(TokenKind.STAR, start);
            case '/' -> single(TokenKind.SLASH, start);
            case '%' -> single(TokenKind.PERCENT, start);
            case '(' -> single(TokenKind.LPAREN, start);
            case ')' -> single(TokenKind.RPAREN, start);
            case ',' -> single(TokenKind.COMMA, start);
            case '.' -> single(TokenKind.DOT, start);
            case '!' -> optionalEquals(TokenKind.BANG, TokenKind.NOT_EQ, start);
            case '<' -> optionalEquals(TokenKind.LT, TokenKind.LTE, start);
            case '>' -> optionalEquals(TokenKind.GT, TokenKind.GTE, start);
            case '=' -> doubled('=', TokenKind.EQ_EQ, "use '==' for equality", start);
            case '&' -> doubled('&', TokenKind.AND_AND, "expected '&&'", start);
            case '|' -> doubled('|', TokenKind.OR_OR, "expected '||'", start);
            default -> throw new ExpressionException("unexpected character '" + c + "'", start);
        }
    }

    private void single(TokenKind kind, int start) {
        pos++;
        add(kind, String.valueOf(source.charAt(start)), start);
    }

    private void optionalEquals(TokenKind bare, TokenKind withEquals, int start) {
        pos++;
        if (pos < source.length() && source.charAt(pos) == '=') {
            pos++;
            add(withEquals, source.substring(start, pos), start);
        } else {
            add(bare, source.substring(start, pos), start);
        }
    }

    private void doubled(char c, TokenKind kind, String hint, int start) {
        pos++;
        if (pos < source.length() && source.charAt(pos) == c) {
            pos++;
            add(kind, source.substring(start, pos), start);
            return;
        }
        throw new ExpressionException("unexpected '" + c + "'", start, hint);
    }

    private static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentContinue(char c) {
        return isIdentStart(c) || (c >= '0' && c <= '9');
    }
}
