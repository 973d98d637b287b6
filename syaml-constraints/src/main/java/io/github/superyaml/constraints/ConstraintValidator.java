package io.github.superyaml.constraints;

import io.github.superyaml.core.BoolValue;
import io.github.superyaml.core.Value;
import io.github.superyaml.core.ValuePath;
import io.github.superyaml.expr.EvalContext;
import io.github.superyaml.expr.EvalResult;
import io.github.superyaml.expr.Expr;
import io.github.superyaml.expr.ExpressionEvaluator;
import io.github.superyaml.expr.ExpressionException;
import io.github.superyaml.expr.Expressions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Logger;

/// Checks a fully resolved document against path-keyed boolean constraints.
///
/// Paths are validated in lexicographic order and expressions in list order.
/// The first failure stops validation. For each path the expressions are all
/// parsed, then checked for contradictions, and only then evaluated against
/// the stored value, so an unsatisfiable set is reported whatever the value is.
///
/// Inside a constraint, `value` is the value at the path and bare references
/// fall back to the enclosing object and then to `value` itself.
public final class ConstraintValidator {

    private static final Logger LOG = Logger.getLogger(ConstraintValidator.class.getName());

    static final int MAX_CONSTRAINT_PATHS = 2048;
    static final int MAX_CONSTRAINTS_PER_PATH = 128;
    static final int MAX_CONSTRAINT_EXPRESSION_LENGTH = 4096;

    private ConstraintValidator() {}

    /// Validates every constraint.
    ///
    /// @param data        the resolved document
    /// @param env         resolved environment bindings
    /// @param constraints path (absolute or shorthand) to constraint sources; a leading `=` is optional
    /// @throws ConstraintException if a constraint is false, non-boolean, contradictory or unaddressable
    /// @throws ExpressionException if a constraint does not parse or fails to evaluate
    public static void validate(Value data, Map<String, Value> env, Map<String, List<String>> constraints) {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(env, "env must not be null");
        Objects.requireNonNull(constraints, "constraints must not be null");

        if (constraints.size() > MAX_CONSTRAINT_PATHS) {
            throw new ConstraintException("too many constraint paths: " + constraints.size()
                    + " (max " + MAX_CONSTRAINT_PATHS + ")");
        }
        LOG.fine(() -> "Validating constraints on " + constraints.size() + " path(s)");

        for (final var entry : new TreeMap<>(constraints).entrySet()) {
            validatePath(data, env, entry.getKey(), entry.getValue());
        }
    }

    private static void validatePath(Value data, Map<String, Value> env, String path, List<String> expressions) {
        if (expressions.size() > MAX_CONSTRAINTS_PER_PATH) {
            throw new ConstraintException("too many constraints for path '" + path + "': " + expressions.size()
                    + " (max " + MAX_CONSTRAINTS_PER_PATH + ")");
        }

        final var normalized = ValuePath.normalize(path);
        final var value = ValuePath.get(data, normalized).orElseThrow(() -> new ConstraintException(
                "constraint path '" + path + "' not found (normalized '" + normalized + "')", normalized, expressions));
        final var scope = ValuePath.parent(normalized).flatMap(p -> ValuePath.get(data, p)).orElse(null);

        final var parsed = new ArrayList<Expr>(expressions.size());
        for (final var expression : expressions) {
            final var source = stripPrefix(expression);
            if (source.length() > MAX_CONSTRAINT_EXPRESSION_LENGTH) {
                throw new ConstraintException("constraint expression at '" + normalized + "' exceeds max length ("
                        + MAX_CONSTRAINT_EXPRESSION_LENGTH + ")", normalized, List.of());
            }
            parsed.add(Expressions.parse(source));
        }

        final var checker = new ContradictionChecker(normalized);
        for (int i = 0; i < parsed.size(); i++) {
            checker.add(expressions.get(i), parsed.get(i));
        }

        final var ctx = EvalContext.forConstraint(data, env, value, scope);
        for (int i = 0; i < parsed.size(); i++) {
            check(normalized, expressions.get(i), ExpressionEvaluator.evaluate(parsed.get(i), ctx));
        }
        LOG.finer(() -> "Constraints at " + normalized + " hold");
    }

    private static void check(String path, String expression, EvalResult result) {
        if (result instanceof EvalResult.Fatal f) {
            throw f.error();
        }
        if (result instanceof EvalResult.Unresolved u) {
            throw new ConstraintException("unresolved dependency while evaluating constraint: " + u.path(),
                    path, List.of(expression));
        }
        final var outcome = ((EvalResult.Success) result).value();
        if (!(outcome instanceof BoolValue b)) {
            throw new ConstraintException("constraint '" + expression + "' at '" + path
                    + "' must evaluate to boolean, got " + outcome.kindName(), path, List.of(expression));
        }
        if (!b.value()) {
            throw new ConstraintException("constraint failed at '" + path + "': '" + expression
                    + "' evaluated to false", path, List.of(expression));
        }
    }

    private static String stripPrefix(String expression) {
        var source = expression.trim();
        while (source.startsWith("=")) {
            source = source.substring(1);
        }
        return source.trim();
    }
}
