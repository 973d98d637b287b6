package io.github.superyaml.expr;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionParserTest extends ExprTestBase {

    @Test
    void testMultiplicationBindsTighterThanAddition() {
        final var expr = Expressions.parse("1 + 2 * 3");
        assertThat(expr).isEqualTo(new Expr.Binary(Expr.BinaryOp.ADD,
                new Expr.NumberLiteral(1),
                new Expr.Binary(Expr.BinaryOp.MUL, new Expr.NumberLiteral(2), new Expr.NumberLiteral(3))));
    }

    @Test
    void testSubtractionIsLeftAssociative() {
        final var expr = Expressions.parse("10 - 4 - 3");
        assertThat(expr).isEqualTo(new Expr.Binary(Expr.BinaryOp.SUB,
                new Expr.Binary(Expr.BinaryOp.SUB, new Expr.NumberLiteral(10), new Expr.NumberLiteral(4)),
                new Expr.NumberLiteral(3)));
    }

    @Test
    void testAndBindsTighterThanOr() {
        final var expr = Expressions.parse("a || b && c");
        assertThat(expr).isInstanceOf(Expr.Binary.class);
        final var or = (Expr.Binary) expr;
        assertThat(or.op()).isEqualTo(Expr.BinaryOp.OR);
        assertThat(or.right()).isEqualTo(new Expr.Binary(Expr.BinaryOp.AND,
                new Expr.Var(List.of("b")), new Expr.Var(List.of("c"))));
    }

    @Test
    void testComparisonBindsTighterThanEquality() {
        final var expr = (Expr.Binary) Expressions.parse("a < b == true");
        assertThat(expr.op()).isEqualTo(Expr.BinaryOp.EQ);
        assertThat(expr.left()).isEqualTo(new Expr.Binary(Expr.BinaryOp.LT,
                new Expr.Var(List.of("a")), new Expr.Var(List.of("b"))));
    }

    @Test
    void testUnaryNesting() {
        assertThat(Expressions.parse("--x")).isEqualTo(new Expr.Unary(Expr.UnaryOp.NEG,
                new Expr.Unary(Expr.UnaryOp.NEG, new Expr.Var(List.of("x")))));
        assertThat(Expressions.parse("!a.b")).isEqualTo(new Expr.Unary(Expr.UnaryOp.NOT,
                new Expr.Var(List.of("a", "b"))));
    }

    @Test
    void testDottedReference() {
        final var expr = Expressions.parse("env.DB_HOST");
        assertThat(expr).isEqualTo(new Expr.Var(List.of("env", "DB_HOST")));
        assertThat(((Expr.Var) expr).dotted()).isEqualTo("env.DB_HOST");
    }

    @Test
    void testCalls() {
        assertThat(Expressions.parse("max(a, 2)")).isEqualTo(new Expr.Call("max",
                List.of(new Expr.Var(List.of("a")), new Expr.NumberLiteral(2))));
        assertThat(Expressions.parse("min()")).isEqualTo(new Expr.Call("min", List.of()));
        assertThat(Expressions.parse("abs(1,)")).isEqualTo(new Expr.Call("abs", List.of(new Expr.NumberLiteral(1))));
    }

    @Test
    void testDottedCallIsRejected() {
        assertThatThrownBy(() -> Expressions.parse("a.b(1)"))
                .isInstanceOf(ExpressionException.class)
                .hasMessageContaining("unexpected token after expression at 3");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1 +", "(1 + 2", "max(1, 2", "a.", "1 2", ")", "a..b", "max(,)"})
    void testMalformedExpressions(String source) {
        assertThatThrownBy(() -> Expressions.parse(source))
                .isInstanceOf(ExpressionException.class)
                .hasMessageStartingWith("expression error: ");
    }

    @Test
    void testErrorCarriesPosition() {
        final var ex = org.junit.jupiter.api.Assertions.assertThrows(ExpressionException.class,
                () -> Expressions.parse("1 + * 2"));
        assertThat(ex.position()).isEqualTo(4);
        assertThat(ex.getMessage()).isEqualTo("expression error: unexpected token '*' at 4");
    }

    @Test
    void testNestingDepthLimit() {
        final var deepest = "(".repeat(2047) + "1" + ")".repeat(2047);
        assertThat(deepest).hasSizeLessThanOrEqualTo(4096);
        assertThat(Expressions.parse(deepest)).isEqualTo(new Expr.NumberLiteral(1));

        final var nestedCalls = "abs(".repeat(800) + "-1" + ")".repeat(800);
        assertThat(Expressions.parse(nestedCalls)).isInstanceOf(Expr.Call.class);

        final var negations = Expressions.parse("-".repeat(4000) + "1");
        assertThat(negations).isInstanceOf(Expr.Unary.class);

        final var tokens = new ArrayList<Token>();
        for (int i = 0; i < 2100; i++) {
            tokens.add(new Token(TokenKind.LPAREN, "(", i));
        }
        tokens.add(new Token(TokenKind.NUMBER, "1", 2100));
        for (int i = 0; i < 2100; i++) {
            tokens.add(new Token(TokenKind.RPAREN, ")", 2101 + i));
        }
        tokens.add(new Token(TokenKind.EOF, "", 4201));
        assertThatThrownBy(() -> ExpressionParser.parse(tokens))
                .isInstanceOf(ExpressionException.class)
                .hasMessageContaining("expression exceeds max nesting depth (2048)");
    }

    @Test
    void testPrefixChainsMixWithBinaryOperators() {
        assertThat(Expressions.parse("!-a == -!b")).isEqualTo(new Expr.Binary(Expr.BinaryOp.EQ,
                new Expr.Unary(Expr.UnaryOp.NOT, new Expr.Unary(Expr.UnaryOp.NEG, new Expr.Var(List.of("a")))),
                new Expr.Unary(Expr.UnaryOp.NEG, new Expr.Unary(Expr.UnaryOp.NOT, new Expr.Var(List.of("b"))))));
        assertThat(Expressions.parse("max((1), 2,)")).isEqualTo(new Expr.Call("max",
                List.of(new Expr.NumberLiteral(1), new Expr.NumberLiteral(2))));
        assertThatThrownBy(() -> Expressions.parse("max((1) 2)"))
                .isInstanceOf(ExpressionException.class)
                .hasMessageContaining("expected ')' after call");
    }
}
