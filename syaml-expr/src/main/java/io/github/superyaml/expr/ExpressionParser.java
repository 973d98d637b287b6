package io.github.superyaml.expr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Operator-precedence parser from tokens to {@link Expr}.
///
/// Binary operators, lowest precedence first, each level left-associative:
/// ```
/// 1  ||
/// 2  &&
/// 3  ==  !=
/// 4  <  <=  >  >=
/// 5  +  -
/// 6  *  /  %
/// ```
/// Prefix `-` and `!` bind tighter than any binary operator. Primaries are
/// literals, `IDENT ( "." IDENT )*`, calls `IDENT "(" args? ")"` and parenthesised
/// expressions. Only a single bare identifier followed by `(` is a call; `a.b(1)` is rejected.
final class ExpressionParser {

    private static final Logger LOG = Logger.getLogger(ExpressionParser.class.getName());

    /// Ceiling on nested parentheses and call arguments. Each level costs at
    /// least two tokens, so no expression within the lexer's token limit reaches it.
    static final int MAX_DEPTH = 2048;

    private static final int LOWEST_PRECEDENCE = 1;

    private final List<Token> tokens;
    private int pos;
    private int depth;

    private ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /// Parses a complete token stream; every token up to `EOF` must be consumed.
    /// @throws ExpressionException if the tokens do not form one expression
    static Expr parse(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).kind() != TokenKind.EOF) {
            throw new IllegalArgumentException("token stream must end with EOF");
        }
        final var parser = new ExpressionParser(tokens);
        final var expr = parser.parseExpression();
        if (parser.current().kind() != TokenKind.EOF) {
            throw new ExpressionException("unexpected token after expression", parser.current().position());
        }
        LOG.finer(() -> "Parsed expression: " + expr);
        return expr;
    }

    /// What closes a frame: end of input, a `)` or the end of a call argument.
    private enum FrameKind { TOP, PAREN, CALL }

    /// One level of nesting. Holds the operand and operator stacks for the
    /// expression being read, plus the prefix operators of the next operand.
    private static final class Frame {
        final FrameKind kind;
        final String callName;
        final List<Expr> args = new ArrayList<>();
        final Deque<Expr> operands = new ArrayDeque<>();
        final Deque<Expr.BinaryOp> operators = new ArrayDeque<>();
        final List<Expr.UnaryOp> prefixes = new ArrayList<>();

        Frame(FrameKind kind, String callName) {
            this.kind = kind;
            this.callName = callName;
        }

        void push(Expr operand) {
            var expr = operand;
            for (int i = prefixes.size() - 1; i >= 0; i--) {
                expr = new Expr.Unary(prefixes.get(i), expr);
            }
            prefixes.clear();
            operands.push(expr);
        }

        /// Folds every pending operator that binds at least as tightly as `minPrecedence`.
        void reduce(int minPrecedence) {
            while (!operators.isEmpty() && precedence(operators.peek()) >= minPrecedence) {
                final var op = operators.pop();
                final var right = operands.pop();
                final var left = operands.pop();
                operands.push(new Expr.Binary(op, left, right));
            }
        }

        Expr finish() {
            reduce(LOWEST_PRECEDENCE);
            return operands.pop();
        }
    }

    /// Operator-precedence parse over an explicit frame stack, so neither
    /// parentheses nor prefix chains consume Java stack.
    private Expr parseExpression() {
        final var frames = new ArrayDeque<Frame>();
        enter();
        frames.push(new Frame(FrameKind.TOP, null));
        boolean expectOperand = true;
        while (true) {
            final var frame = frames.peek();
            if (expectOperand) {
                if (readOperand(frame, frames)) {
                    expectOperand = false;
                }
                continue;
            }

            final var op = binaryOperator(current().kind());
            if (op != null) {
                pos++;
                frame.reduce(precedence(op));
                frame.operators.push(op);
                expectOperand = true;
                continue;
            }

            final var result = frame.finish();
            switch (frame.kind) {
                case TOP -> {
                    depth--;
                    return result;
                }
                case PAREN -> {
                    expect(TokenKind.RPAREN, "expected ')' after expression");
                    closeFrame(frames).push(result);
                }
                case CALL -> {
                    frame.args.add(result);
                    if (consume(TokenKind.COMMA)) {
                        // a trailing comma before ')' is allowed
                        if (!consume(TokenKind.RPAREN)) {
                            expectOperand = true;
                            continue;
                        }
                    } else {
                        expect(TokenKind.RPAREN, "expected ')' after call");
                    }
                    closeFrame(frames).push(new Expr.Call(frame.callName, frame.args));
                }
            }
        }
    }

    /// Reads prefix operators and one primary into `frame`. Returns false when
    /// a `(` or a call opened a new frame instead.
    private boolean readOperand(Frame frame, Deque<Frame> frames) {
        while (true) {
            if (consume(TokenKind.MINUS)) {
                frame.prefixes.add(Expr.UnaryOp.NEG);
            } else if (consume(TokenKind.BANG)) {
                frame.prefixes.add(Expr.UnaryOp.NOT);
            } else {
                break;
            }
        }
        final var token = current();
        switch (token.kind()) {
            case NUMBER -> {
                pos++;
                frame.push(new Expr.NumberLiteral(parseNumber(token)));
                return true;
            }
            case STRING -> {
                pos++;
                frame.push(new Expr.StringLiteral(token.text()));
                return true;
            }
            case BOOL -> {
                pos++;
                frame.push(new Expr.BoolLiteral(Boolean.parseBoolean(token.text())));
                return true;
            }
            case NULL -> {
                pos++;
                frame.push(new Expr.NullLiteral());
                return true;
            }
            case IDENT -> {
                final var segments = readSegments();
                if (segments.size() != 1 || !consume(TokenKind.LPAREN)) {
                    frame.push(new Expr.Var(segments));
                    return true;
                }
                if (consume(TokenKind.RPAREN)) {
                    frame.push(new Expr.Call(segments.get(0), List.of()));
                    return true;
                }
                enter();
                frames.push(new Frame(FrameKind.CALL, segments.get(0)));
                return false;
            }
            case LPAREN -> {
                pos++;
                enter();
                frames.push(new Frame(FrameKind.PAREN, null));
                return false;
            }
            default -> throw new ExpressionException("unexpected token " + token.describe(), token.position());
        }
    }

    private List<String> readSegments() {
        final var segments = new ArrayList<String>();
        segments.add(current().text());
        pos++;
        while (consume(TokenKind.DOT)) {
            final var next = current();
            if (next.kind() != TokenKind.IDENT) {
                throw new ExpressionException("expected identifier after '.'", next.position());
            }
            pos++;
            segments.add(next.text());
        }
        return segments;
    }

    private Frame closeFrame(Deque<Frame> frames) {
        frames.pop();
        depth--;
        return frames.peek();
    }

    private static Expr.BinaryOp binaryOperator(TokenKind kind) {
        return switch (kind) {
            case OR_OR -> Expr.BinaryOp.OR;
            case AND_AND -> Expr.BinaryOp.AND;
            case EQ_EQ -> Expr.BinaryOp.EQ;
            case NOT_EQ -> Expr.BinaryOp.NOT_EQ;
            case LT -> Expr.BinaryOp.LT;
            case LTE -> Expr.BinaryOp.LTE;
            case GT -> Expr.BinaryOp.GT;
            case GTE -> Expr.BinaryOp.GTE;
            case PLUS -> Expr.BinaryOp.ADD;
            case MINUS -> Expr.BinaryOp.SUB;
            case STAR -> Expr.BinaryOp.MUL;
            case SLASH -> Expr.BinaryOp.DIV;
            case PERCENT -> Expr.BinaryOp.MOD;
            default -> null;
        };
    }

    private static int precedence(Expr.BinaryOp op) {
        return switch (op) {
            case OR -> 1;
            case AND -> 2;
            case EQ, NOT_EQ -> 3;
            case LT, LTE, GT, GTE -> 4;
            case ADD, SUB -> 5;
            case MUL, DIV, MOD -> 6;
        };
    }

    private static double parseNumber(Token token) {
        try {
            return Double.parseDouble(token.text());
        } catch (NumberFormatException ex) {
            throw new ExpressionException("invalid number literal '" + token.text() + "'", token.position());
        }
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw new ExpressionException("expression exceeds max nesting depth (" + MAX_DEPTH + ")", current().position());
        }
    }

    private Token current() {
        return tokens.get(pos);
    }

    private boolean consume(TokenKind kind) {
        if (current().kind() == kind) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(TokenKind kind, String message) {
        if (!consume(kind)) {
            throw new ExpressionException(message, current().position());
        }
    }
}
