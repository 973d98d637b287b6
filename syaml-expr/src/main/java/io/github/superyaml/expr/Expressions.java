package io.github.superyaml.expr;

import java.util.Objects;
import java.util.logging.Logger;

/// Entry points of the expression language.
///
/// ```java
/// Expr expr = Expressions.parse("price * qty + env.TAX");
/// EvalResult result = ExpressionEvaluator.evaluate(expr, EvalContext.forResolution(data, env, Set.of()));
/// ```
public final class Expressions {

    private static final Logger LOG = Logger.getLogger(Expressions.class.getName());

    private Expressions() {}

    /// Tokenizes and parses expression source.
    /// @throws ExpressionException if the source is not a single well-formed expression
    public static Expr parse(String source) {
        Objects.requireNonNull(source, "source must not be null");
        LOG.fine(() -> "Parsing expression: " + source);
        return ExpressionParser.parse(ExpressionLexer.tokenize(source));
    }

    /// Parses and evaluates in one step.
    /// @return the outcome; a parse failure is reported as {@link EvalResult.Fatal}
    public static EvalResult evaluate(String source, EvalContext ctx) {
        final Expr expr;
        try {
            expr = parse(source);
        } catch (ExpressionException ex) {
            return new EvalResult.Fatal(ex);
        }
        return ExpressionEvaluator.evaluate(expr, ctx);
    }
}
