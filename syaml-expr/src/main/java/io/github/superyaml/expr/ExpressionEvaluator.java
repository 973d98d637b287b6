package io.github.superyaml.expr;

import io.github.superyaml.core.BoolValue;
import io.github.superyaml.core.NullValue;
import io.github.superyaml.core.StringValue;
import io.github.superyaml.core.Value;
import io.github.superyaml.core.ValuePath;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Tree-walking evaluator for {@link Expr}.
///
/// Evaluation has no hidden state: the same expression and context always
/// produce the same result. Every operand of a binary operator is evaluated,
/// left first, including both sides of `&&` and `||`.
///
/// A reference to a path listed in {@link EvalContext#unresolvedPaths()}
/// yields {@link EvalResult.Unresolved}; every other failure yields
/// {@link EvalResult.Fatal}.
public final class ExpressionEvaluator {

    private static final Logger LOG = Logger.getLogger(ExpressionEvaluator.class.getName());

    static final String ENV_ROOT = "env";
    static final String VALUE_ROOT = "value";

    private ExpressionEvaluator() {}

    /// Evaluates an expression.
    /// @param expr the parsed expression
    /// @param ctx  the evaluation context
    /// @return the outcome, never `null`
    public static EvalResult evaluate(Expr expr, EvalContext ctx) {
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(ctx, "ctx must not be null");
        try {
            return eval(expr, ctx);
        } catch (ExpressionException ex) {
            LOG.finer(() -> "Evaluation failed: " + ex.getMessage());
            return new EvalResult.Fatal(ex);
        }
    }

    private static EvalResult eval(Expr expr, EvalContext ctx) {
        if (expr instanceof Expr.NumberLiteral n) {
            return success(ValueOps.number(n.value()));
        }
        if (expr instanceof Expr.StringLiteral s) {
            return success(StringValue.of(s.value()));
        }
        if (expr instanceof Expr.BoolLiteral b) {
            return success(BoolValue.of(b.value()));
        }
        if (expr instanceof Expr.NullLiteral) {
            return success(NullValue.of());
        }
        if (expr instanceof Expr.Var v) {
            return resolveVar(v, ctx);
        }
        if (expr instanceof Expr.Unary u) {
            return evalUnaryChain(u, ctx);
        }
        if (expr instanceof Expr.Binary b) {
            final var left = eval(b.left(), ctx);
            if (!(left instanceof EvalResult.Success l)) {
                return left;
            }
            final var right = eval(b.right(), ctx);
            if (!(right instanceof EvalResult.Success r)) {
                return right;
            }
            return success(ValueOps.binary(b.op(), l.value(), r.value()));
        }
        final var call = (Expr.Call) expr;
        final var args = new ArrayList<Value>(call.args().size());
        for (final var arg : call.args()) {
            final var result = eval(arg, ctx);
            if (!(result instanceof EvalResult.Success s)) {
                return result;
            }
            args.add(s.value());
        }
        final var function = BuiltinFunction.byName(call.name())
                .orElseThrow(() -> new ExpressionException("unknown function '" + call.name() + "'"));
        return success(function.invoke(args));
    }

    /// A run of prefix operators is applied in a loop, innermost first.
    private static EvalResult evalUnaryChain(Expr.Unary outer, EvalContext ctx) {
        final var ops = new ArrayList<Expr.UnaryOp>();
        Expr operand = outer;
        while (operand instanceof Expr.Unary u) {
            ops.add(u.op());
            operand = u.operand();
        }
        final var inner = eval(operand, ctx);
        if (!(inner instanceof EvalResult.Success s)) {
            return inner;
        }
        var value = s.value();
        for (int i = ops.size() - 1; i >= 0; i--) {
            value = ValueOps.unary(ops.get(i), value);
        }
        return success(value);
    }

    private static EvalResult resolveVar(Expr.Var var, EvalContext ctx) {
        final List<String> path = var.segments();
        final var head = path.get(0);

        if (ENV_ROOT.equals(head)) {
            if (path.size() != 2) {
                throw new ExpressionException("env reference must be env.NAME, got " + var.dotted());
            }
            final var bound = ctx.env().get(path.get(1));
            if (bound == null) {
                throw new ExpressionException("unknown env binding '" + path.get(1) + "'");
            }
            return success(bound);
        }

        if (VALUE_ROOT.equals(head)) {
            final var base = ctx.value().orElseThrow(() ->
                    new ExpressionException("'value' is only available in constraint expressions"));
            if (path.size() == 1) {
                return success(base);
            }
            return ValuePath.lookupKeys(base, path.subList(1, path.size()))
                    .<EvalResult>map(EvalResult.Success::new)
                    .orElseThrow(() -> new ExpressionException("path '" + var.dotted() + "' not found under value"));
        }

        final var absolute = "$." + var.dotted();
        if (ctx.unresolvedPaths().contains(absolute)) {
            LOG.finest(() -> "Reference to pending path " + absolute);
            return new EvalResult.Unresolved(absolute);
        }

        Optional<Value> found = ValuePath.lookupKeys(ctx.data(), path);
        if (found.isEmpty()) {
            found = ctx.scope().flatMap(scope -> ValuePath.lookupKeys(scope, path));
        }
        if (found.isEmpty()) {
            found = ctx.value().flatMap(current -> ValuePath.lookupKeys(current, path));
        }
        return found.<EvalResult>map(EvalResult.Success::new)
                .orElseThrow(() -> new ExpressionException("unknown reference '" + var.dotted() + "'"));
    }

    private static EvalResult success(Value value) {
        return new EvalResult.Success(value);
    }
}
