package io.github.superyaml.constraints;

import io.github.superyaml.expr.Expr;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Finds constraint sets on one path that no value could satisfy.
///
/// Each expression is split on its top-level `&&` into comparisons. Two
/// shapes are tracked:
///
/// - `a OP b` with both sides references: the allowed orderings of the pair
///   are intersected; an empty intersection is a contradiction.
/// - `a OP number` or `number OP a`: the bounds of `a` are tightened; an empty
///   interval, or a single allowed point that is also excluded by `!=`, is a
///   contradiction.
///
/// Anything else is left for runtime evaluation. A fresh checker is used for
/// every path.
final class ContradictionChecker {

    private static final Logger LOG = Logger.getLogger(ContradictionChecker.class.getName());

    private final String path;
    private final Map<String, PairState> pairs = new HashMap<>();
    private final Map<String, IntervalState> intervals = new HashMap<>();

    ContradictionChecker(String path) {
        this.path = path;
    }

    /// Adds one parsed constraint.
    /// @param source the constraint text, cited in errors
    /// @throws ConstraintException if the constraints seen so far cannot all hold
    void add(String source, Expr expr) {
        for (final var atom : conjuncts(expr, new ArrayList<>())) {
            if (!(atom instanceof Expr.Binary b) || !b.op().isComparison()) {
                continue;
            }
            if (b.left() instanceof Expr.Var l && b.right() instanceof Expr.Var r) {
                addPair(source, l.dotted(), b.op(), r.dotted());
            } else if (b.left() instanceof Expr.Var l && constant(b.right()) != null) {
                addBound(source, l.dotted(), b.op(), constant(b.right()));
            } else if (constant(b.left()) != null && b.right() instanceof Expr.Var r) {
                addBound(source, r.dotted(), b.op().flipped(), constant(b.left()));
            }
        }
    }

    private static List<Expr> conjuncts(Expr expr, List<Expr> out) {
        if (expr instanceof Expr.Binary b && b.op() == Expr.BinaryOp.AND) {
            conjuncts(b.left(), out);
            conjuncts(b.right(), out);
        } else {
            out.add(expr);
        }
        return out;
    }

    // a literal number, or a negated one
    private static Double constant(Expr expr) {
        if (expr instanceof Expr.NumberLiteral n) {
            return n.value();
        }
        if (expr instanceof Expr.Unary u && u.op() == Expr.UnaryOp.NEG && u.operand() instanceof Expr.NumberLiteral n) {
            return -n.value();
        }
        return null;
    }

    private void addPair(String source, String left, Expr.BinaryOp op, String right) {
        if (left.equals(right)) {
            return;
        }
        var allowed = Relation.allowedBy(op);
        final String key;
        if (left.compareTo(right) < 0) {
            key = left + "\u0000" + right;
        } else {
            key = right + "\u0000" + left;
            allowed = Relation.inverted(allowed);
        }
        final var state = pairs.computeIfAbsent(key, k -> new PairState());
        state.relations.retainAll(allowed);
        if (state.relations.isEmpty()) {
            throw impossible(state.lastSource, source);
        }
        state.lastSource = source;
        LOG.finest(() -> "Pair " + left + "/" + right + " narrowed by '" + source + "'");
    }

    private void addBound(String source, String variable, Expr.BinaryOp op, double value) {
        final var state = intervals.computeIfAbsent(variable, k -> new IntervalState());
        switch (op) {
            case GT -> state.tightenLower(new Bound(value, true, source));
            case GTE -> state.tightenLower(new Bound(value, false, source));
            case LT -> state.tightenUpper(new Bound(value, true, source));
            case LTE -> state.tightenUpper(new Bound(value, false, source));
            case EQ -> {
                state.tightenLower(new Bound(value, false, source));
                state.tightenUpper(new Bound(value, false, source));
            }
            case NOT_EQ -> state.excluded.add(new Bound(value, false, source));
            default -> throw new IllegalStateException("not a comparison: " + op);
        }
        state.verify();
        LOG.finest(() -> "Interval for " + variable + " narrowed by '" + source + "'");
    }

    private ConstraintException impossible(String first, String second) {
        LOG.fine(() -> "Contradiction at " + path + " between '" + first + "' and '" + second + "'");
        return new ConstraintException("impossible constraints at '" + path + "': '" + first + "' and '"
                + second + "' cannot both hold", path, List.of(first, second));
    }

    private static final class PairState {
        final EnumSet<Relation> relations = EnumSet.allOf(Relation.class);
        String lastSource;
    }

    /// @param exclusive `true` for `<`/`>`; unused for exclusions
    private record Bound(double value, boolean exclusive, String source) {}

    private final class IntervalState {
        Bound lower;
        Bound upper;
        final List<Bound> excluded = new ArrayList<>();

        void tightenLower(Bound candidate) {
            if (lower == null || candidate.value() > lower.value()
                    || (candidate.value() == lower.value() && candidate.exclusive() && !lower.exclusive())) {
                lower = candidate;
            }
        }

        void tightenUpper(Bound candidate) {
            if (upper == null || candidate.value() < upper.value()
                    || (candidate.value() == upper.value() && candidate.exclusive() && !upper.exclusive())) {
                upper = candidate;
            }
        }

        void verify() {
            if (lower == null || upper == null) {
                return;
            }
            if (lower.value() > upper.value()
                    || (lower.value() == upper.value() && (lower.exclusive() || upper.exclusive()))) {
                throw impossible(lower.source(), upper.source());
            }
            if (lower.value() == upper.value()) {
                for (final var ex : excluded) {
                    if (ex.value() == lower.value()) {
                        throw impossible(lower.source(), ex.source());
                    }
                }
            }
        }
    }
}
